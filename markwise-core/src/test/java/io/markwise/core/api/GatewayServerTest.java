package io.markwise.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.error.UpstreamException;
import io.markwise.core.grading.GradingEngine;
import io.markwise.core.grading.PromptSettingsService;
import io.markwise.core.provider.CompletionRequest;
import io.markwise.core.provider.RawCompletion;
import io.markwise.core.provider.ScriptedCompletionClient;
import io.markwise.core.results.ResultQueryService;
import io.markwise.core.retry.RecordingSleeper;
import io.markwise.core.session.SessionService;
import io.markwise.core.store.InMemoryResultStore;
import io.markwise.core.store.InMemorySessionStore;
import io.markwise.core.store.InMemorySettingsStore;
import io.markwise.core.store.PersistenceCoordinator;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GatewayServerTest {

    private static final String ANSWER = "{\"answers\":[{\"question_id\":\"Q1\",\"marks_awarded\":3,\"rubric_notes\":\"ok\"}]}";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final InMemorySessionStore sessionStore = new InMemorySessionStore();
    private final InMemoryResultStore resultStore = new InMemoryResultStore();
    private GradingEngine engine;
    private GatewayServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void shouldReportHealth() throws Exception {
        start(request -> ScriptedCompletionClient.completion(ANSWER));

        HttpResponse<String> response = send("GET", "/healthz", null, null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).path("status").asText()).isEqualTo("ok");
    }

    @Test
    void shouldGradeSessionConfiguredOverHttp() throws Exception {
        start(request -> ScriptedCompletionClient.completion(ANSWER));

        HttpResponse<String> created = send("POST", "/sessions", "", null);
        assertThat(created.statusCode()).isEqualTo(201);
        String sessionId = json(created).path("session_id").asText();
        assertThat(json(created).path("status").asText()).isEqualTo("created");

        assertThat(send("POST", "/images/register", """
            {"session_id": "%s", "role": "student", "url": "https://img/s1.png", "order_index": 0}
            """.formatted(sessionId), null).statusCode()).isEqualTo(200);
        assertThat(send("POST", "/images/register", """
            {"session_id": "%s", "role": "answer_key", "url": "https://img/k1.png", "order_index": 0}
            """.formatted(sessionId), null).statusCode()).isEqualTo(200);
        HttpResponse<String> configured = send("POST", "/questions/config", """
            {"session_id": "%s", "questions": [{"question_id": "Q1", "number": 1, "max_marks": 5}]}
            """.formatted(sessionId), null);
        assertThat(json(configured).path("ok").asBoolean()).isTrue();

        HttpResponse<String> graded = send("POST", "/grade/single", """
            {"session_id": "%s", "models": [{"name": "openai/gpt-4o", "tries": 2}]}
            """.formatted(sessionId), null);
        assertThat(graded.statusCode()).isEqualTo(200);
        assertThat(json(graded).path("ok").asBoolean()).isTrue();
        assertThat(json(graded).path("session_id").asText()).isEqualTo(sessionId);

        HttpResponse<String> results = send("GET", "/results/" + sessionId, null, null);
        JsonNode tries = json(results).path("results_by_question").path("Q1").path("openai/gpt-4o");
        assertThat(tries.size()).isEqualTo(2);
        assertThat(tries.get(0).path("marks_awarded").asDouble()).isEqualTo(3.0);

        HttpResponse<String> errors = send("GET", "/results/errors/" + sessionId, null, null);
        assertThat(errors.statusCode()).isEqualTo(200);
        assertThat(json(errors).path("errors_by_model_try").isEmpty()).isTrue();
    }

    @Test
    void shouldRenderErrorEnvelopeWithCorrelationId() throws Exception {
        start(request -> ScriptedCompletionClient.completion(ANSWER));

        HttpResponse<String> missing = send("GET", "/results/unknown-session", null, "req-42");

        assertThat(missing.statusCode()).isEqualTo(404);
        assertThat(missing.headers().firstValue("X-Request-ID")).contains("req-42");
        JsonNode error = json(missing).path("error");
        assertThat(error.path("code").asText()).isEqualTo("NOT_FOUND");
        assertThat(error.path("correlation_id").asText()).isEqualTo("req-42");
    }

    @Test
    void shouldRejectInvalidRequestBodies() throws Exception {
        start(request -> ScriptedCompletionClient.completion(ANSWER));
        String sessionId = sessionStore.create().id();

        HttpResponse<String> badRole = send("POST", "/images/register", """
            {"session_id": "%s", "role": "teacher", "url": "https://img/1.png", "order_index": 0}
            """.formatted(sessionId), null);
        HttpResponse<String> malformed = send("POST", "/grade/single", "{not json", null);
        HttpResponse<String> noModels = send("POST", "/grade/single", """
            {"session_id": "%s"}
            """.formatted(sessionId), null);

        assertThat(badRole.statusCode()).isEqualTo(422);
        assertThat(json(badRole).path("error").path("code").asText()).isEqualTo("VALIDATION_ERROR");
        assertThat(malformed.statusCode()).isEqualTo(422);
        assertThat(noModels.statusCode()).isEqualTo(422);
        assertThat(json(noModels).path("error").path("correlation_id").asText()).isNotBlank();
    }

    @Test
    void shouldRejectWrongMethod() throws Exception {
        start(request -> ScriptedCompletionClient.completion(ANSWER));

        HttpResponse<String> response = send("GET", "/grade/single", null, null);

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(json(response).path("error").path("code").asText()).isEqualTo("METHOD_NOT_ALLOWED");
    }

    @Test
    void shouldForwardRetryAfterWhenRateLimited() throws Exception {
        start(request -> {
            throw new UpstreamException(429, "OpenRouter returned HTTP 429", "5", "slow down");
        });
        String sessionId = sessionStore.create().id();
        send("POST", "/images/register", """
            {"session_id": "%s", "role": "student", "url": "https://img/s1.png", "order_index": 0}
            """.formatted(sessionId), null);
        send("POST", "/questions/config", """
            {"session_id": "%s", "questions": [{"question_id": "Q1", "number": 1, "max_marks": 5}]}
            """.formatted(sessionId), null);

        HttpResponse<String> response = send("POST", "/grade/single", """
            {"session_id": "%s", "models": [{"name": "m"}]}
            """.formatted(sessionId), null);

        assertThat(response.statusCode()).isEqualTo(429);
        assertThat(response.headers().firstValue("Retry-After")).contains("5");
        JsonNode error = json(response).path("error");
        assertThat(error.path("code").asText()).isEqualTo("UPSTREAM_ERROR");
        assertThat(error.path("details").path("openrouter_body").asText()).isEqualTo("slow down");
    }

    @Test
    void shouldReadAndSavePromptSettings() throws Exception {
        start(request -> ScriptedCompletionClient.completion(ANSWER));

        HttpResponse<String> defaults = send("GET", "/settings/prompt", null, null);
        assertThat(json(defaults).path("system_template").asText()).contains("[Question list]");

        HttpResponse<String> saved = send("PUT", "/settings/prompt", """
            {"system_template": "Grade [Question list]", "user_template": "Pages: [Student assessment]", "schema_template": "JSON only"}
            """, null);
        assertThat(saved.statusCode()).isEqualTo(200);

        JsonNode reloaded = json(send("GET", "/settings/prompt", null, null));
        assertThat(reloaded.path("system_template").asText()).isEqualTo("Grade [Question list]");
        assertThat(reloaded.path("user_template").asText()).isEqualTo("Pages: [Student assessment]");

        HttpResponse<String> incomplete = send("PUT", "/settings/prompt", """
            {"system_template": "Grade", "user_template": ""}
            """, null);
        assertThat(incomplete.statusCode()).isEqualTo(422);

        HttpResponse<String> rubric = send("GET", "/settings/rubric-prompt", null, null);
        assertThat(rubric.statusCode()).isEqualTo(200);
        assertThat(json(rubric).path("system_template").asText()).isNotBlank();
    }

    @Test
    void shouldAllowLocalCorsPreflight() throws Exception {
        start(request -> ScriptedCompletionClient.completion(ANSWER));

        HttpRequest preflight = HttpRequest.newBuilder(uri("/grade/single"))
            .header("Origin", "http://localhost:5173")
            .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<String> response = client.send(preflight, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(204);
        assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).contains("http://localhost:5173");
    }

    private void start(Function<CompletionRequest, RawCompletion> script) {
        SessionService sessions = new SessionService(sessionStore);
        PromptSettingsService promptSettings = new PromptSettingsService(new InMemorySettingsStore());
        PersistenceCoordinator persistence = new PersistenceCoordinator(
            resultStore,
            PersistenceCoordinator.storageDefaults(),
            new RecordingSleeper(),
            PersistenceCoordinator.BATCH_SIZE
        );
        engine = new GradingEngine(sessionStore, new ScriptedCompletionClient(script), persistence, promptSettings, null, 2, false);
        server = new GatewayServer(0, "127.0.0.1", engine, sessions, new ResultQueryService(sessions, resultStore), promptSettings);
        server.start();
    }

    private HttpResponse<String> send(String method, String path, String body, String requestId) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path))
            .method(method, body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(body))
            .header("Content-Type", "application/json");
        if (requestId != null) {
            builder.header("X-Request-ID", requestId);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }
}
