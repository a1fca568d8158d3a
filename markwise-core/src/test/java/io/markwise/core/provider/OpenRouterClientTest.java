package io.markwise.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.error.ConfigException;
import io.markwise.core.error.UpstreamException;
import io.markwise.core.model.ChatMessage;
import io.markwise.core.model.ContentPart;
import io.markwise.core.retry.RecordingSleeper;
import io.markwise.core.retry.RetryPolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OpenRouterClientTest {

    private static final String OK_BODY = """
        {
          "model": "openai/gpt-4o",
          "choices": [
            { "message": { "role": "assistant", "content": "{\\"answers\\":[]}" }, "finish_reason": "stop" }
          ]
        }
        """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private MockWebServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPostChatCompletionWithImagePartsAndHeaders() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(OK_BODY));
        OpenRouterClient client = client(null);

        RawCompletion completion = client.complete(new CompletionRequest(
            "openai/gpt-4o",
            List.of(
                ChatMessage.system("grade carefully"),
                ChatMessage.user(List.of(ContentPart.text("pages:"), ContentPart.image("https://img/1.png")))
            ),
            Map.of("effort", "high"),
            "s1",
            "openai/gpt-4o",
            1
        ));

        assertThat(completion.model()).isEqualTo("openai/gpt-4o");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("X-Title")).isEqualTo("Markwise");

        JsonNode payload = mapper.readTree(request.getBody().readUtf8());
        assertThat(payload.path("model").asText()).isEqualTo("openai/gpt-4o");
        assertThat(payload.path("provider").path("allow_fallbacks").asBoolean(true)).isFalse();
        assertThat(payload.path("reasoning").path("effort").asText()).isEqualTo("high");
        assertThat(payload.path("messages").get(0).path("content").asText()).isEqualTo("grade carefully");
        JsonNode userParts = payload.path("messages").get(1).path("content");
        assertThat(userParts.get(0).path("text").asText()).isEqualTo("pages:");
        assertThat(userParts.get(1).path("image_url").path("url").asText()).isEqualTo("https://img/1.png");
        assertThat(userParts.get(1).path("image_url").path("detail").asText()).isEqualTo("high");
    }

    @Test
    void shouldPinClaudeModelsToAnthropicAndOmitEmptyReasoning() throws Exception {
        server.enqueue(new MockResponse().setBody(OK_BODY));

        client(null).complete(CompletionRequest.of("claude-sonnet-4", List.of(ChatMessage.user("hi"))));

        JsonNode payload = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(payload.path("model").asText()).isEqualTo("anthropic/claude-sonnet-4");
        assertThat(payload.path("provider").path("order").get(0).asText()).isEqualTo("Anthropic");
        assertThat(payload.has("reasoning")).isFalse();
    }

    @Test
    void shouldForwardReasoningFieldsWithNullValues() throws Exception {
        server.enqueue(new MockResponse().setBody(OK_BODY));
        Map<String, Object> reasoning = new LinkedHashMap<>();
        reasoning.put("effort", "low");
        reasoning.put("max_tokens", null);

        client(null).complete(new CompletionRequest("openai/o3", List.of(ChatMessage.user("hi")), reasoning, "s1", "openai/o3", 1));

        JsonNode sent = mapper.readTree(server.takeRequest().getBody().readUtf8()).path("reasoning");
        assertThat(sent.path("effort").asText()).isEqualTo("low");
        assertThat(sent.has("max_tokens")).isTrue();
        assertThat(sent.path("max_tokens").isNull()).isTrue();
    }

    @Test
    void shouldRetryRateLimitsHonouringRetryAfter() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "1").setBody("slow down"));
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "1").setBody("slow down"));
        server.enqueue(new MockResponse().setBody(OK_BODY));

        RawCompletion completion = client(null).complete(CompletionRequest.of("m", List.of(ChatMessage.user("hi"))));

        assertThat(completion.choices().size()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void shouldSurfaceRateLimitAfterFinalAttempt() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(429).setBody("rate limited"));
        }

        assertThatThrownBy(() -> client(null).complete(CompletionRequest.of("m", List.of(ChatMessage.user("hi")))))
            .isInstanceOfSatisfying(UpstreamException.class, error -> {
                assertThat(error.status()).isEqualTo(429);
                assertThat(error.retryAfter()).isEqualTo("2");
                assertThat(error.bodyExcerpt()).isEqualTo("rate limited");
            });
        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void shouldSurfaceServerErrorWithOriginalStatus() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
        }

        assertThatThrownBy(() -> client(null).complete(CompletionRequest.of("m", List.of(ChatMessage.user("hi")))))
            .isInstanceOfSatisfying(UpstreamException.class, error -> {
                assertThat(error.status()).isEqualTo(503);
                assertThat(error.details()).containsEntry("openrouter_body", "unavailable");
            });
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }

    @Test
    void shouldMapInvalidJsonToBadGatewayWithoutRetry() {
        server.enqueue(new MockResponse().setBody("<html>oops</html>"));

        assertThatThrownBy(() -> client(null).complete(CompletionRequest.of("m", List.of(ChatMessage.user("hi")))))
            .isInstanceOfSatisfying(UpstreamException.class, error -> {
                assertThat(error.status()).isEqualTo(502);
                assertThat(error.getMessage()).contains("<html>oops");
            });
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldRefuseToCallWithoutApiKey() {
        OpenRouterClient client = new OpenRouterClient("  ", server.url("/api/v1").toString(), Map.of());

        assertThatThrownBy(client::verifyConfigured)
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("OPENROUTER_API_KEY");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldAppendRequestAndResponseToSessionLog() throws Exception {
        server.enqueue(new MockResponse().setBody(OK_BODY));
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        SessionAuditLog auditLog = new SessionAuditLog(tempDir.resolve("logs"), clock);

        client(auditLog).complete(new CompletionRequest("m", List.of(ChatMessage.user("hi")), Map.of(), "s1", "m", 2));

        String log = Files.readString(auditLog.fileFor("s1"));
        assertThat(log).contains("REQUEST model=m instance_id=m try=2");
        assertThat(log).contains("RESPONSE model=m instance_id=m try=2 status=200");
    }

    private OpenRouterClient client(SessionAuditLog auditLog) {
        return new OpenRouterClient(
            "sk-test",
            server.url("/api/v1").toString(),
            Map.of("X-Title", "Markwise"),
            Duration.ofSeconds(5),
            RetryPolicy.of(3, Duration.ofMillis(10), error -> error instanceof IOException),
            sleeper,
            auditLog,
            false
        );
    }
}
