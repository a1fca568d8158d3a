package io.markwise.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.markwise.core.error.GradingException;
import io.markwise.core.error.UpstreamException;
import io.markwise.core.error.ValidationException;
import io.markwise.core.grading.GradeOutcome;
import io.markwise.core.grading.GradingEngine;
import io.markwise.core.grading.PromptSettingsService;
import io.markwise.core.grading.PromptTemplates;
import io.markwise.core.grading.RubricPromptTemplates;
import io.markwise.core.model.GradeRequest;
import io.markwise.core.model.Question;
import io.markwise.core.model.Session;
import io.markwise.core.results.ResultQueryService;
import io.markwise.core.session.SessionService;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final HttpString REQUEST_ID = new HttpString("X-Request-ID");
    private static final HttpString RETRY_AFTER = new HttpString("Retry-After");
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final GradingEngine engine;
    private final SessionService sessions;
    private final ResultQueryService results;
    private final PromptSettingsService promptSettings;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(
        int port,
        String host,
        GradingEngine engine,
        SessionService sessions,
        ResultQueryService results,
        PromptSettingsService promptSettings
    ) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.results = Objects.requireNonNull(results, "results must not be null");
        this.promptSettings = Objects.requireNonNull(promptSettings, "promptSettings must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/sessions", route(this::handleCreateSession))
            .addExactPath("/images/register", route(this::handleRegisterImage))
            .addExactPath("/questions/config", route(this::handleQuestionsConfig))
            .addExactPath("/grade/single", route(this::handleGradeSingle))
            .addExactPath("/settings/prompt", route(this::handlePromptSettings))
            .addExactPath("/settings/rubric-prompt", route(this::handleRubricPromptSettings))
            .addPrefixPath("/results", route(this::handleResults));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = header(exchange, "Origin");
        if (origin.isBlank() || !isLocalOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,PUT,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization,X-Request-ID");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private boolean isLocalOrigin(String origin) {
        try {
            URI uri = URI.create(origin);
            String hostName = uri.getHost();
            return "http".equalsIgnoreCase(uri.getScheme())
                && hostName != null
                && ("localhost".equalsIgnoreCase(hostName) || "127.0.0.1".equals(hostName));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleCreateSession(HttpServerExchange exchange, String correlationId) throws IOException {
        requireMethod(exchange, "POST");
        Session session = sessions.create();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", session.id());
        body.put("status", session.status().wireValue());
        sendJson(exchange, 201, body);
    }

    private void handleRegisterImage(HttpServerExchange exchange, String correlationId) throws IOException {
        requireMethod(exchange, "POST");
        JsonNode body = readJsonBody(exchange);
        JsonNode orderIndex = body.path("order_index");
        sessions.registerImage(
            requiredText(body, "session_id"),
            requiredText(body, "role"),
            body.path("url").asText(""),
            orderIndex.canConvertToInt() ? orderIndex.asInt() : null
        );
        sendJson(exchange, 200, Map.of("ok", true));
    }

    private void handleQuestionsConfig(HttpServerExchange exchange, String correlationId) throws IOException {
        requireMethod(exchange, "POST");
        JsonNode body = readJsonBody(exchange);
        String sessionId = requiredText(body, "session_id");
        JsonNode items = body.path("questions");
        if (!items.isArray()) {
            throw new ValidationException("questions must be a list");
        }
        List<Question> questions = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.path("number").canConvertToInt() || !item.path("max_marks").isNumber()) {
                throw new ValidationException("each question needs question_id, number and max_marks");
            }
            questions.add(new Question(
                sessionId,
                requiredText(item, "question_id"),
                item.path("number").asInt(),
                item.path("max_marks").asDouble()
            ));
        }
        sessions.configureQuestions(sessionId, questions);
        sendJson(exchange, 200, Map.of("ok", true));
    }

    private void handleGradeSingle(HttpServerExchange exchange, String correlationId) throws IOException {
        requireMethod(exchange, "POST");
        GradeRequest request = mapper.treeToValue(readJsonBody(exchange), GradeRequest.class);
        LOG.info("Grade request session={} correlation_id={}", request.sessionId(), correlationId);
        GradeOutcome outcome = engine.grade(request);
        sendJson(exchange, 200, outcome.toResponse());
    }

    private void handleResults(HttpServerExchange exchange, String correlationId) throws IOException {
        requireMethod(exchange, "GET");
        String path = exchange.getRelativePath();
        String relative = path.startsWith("/") ? path.substring(1) : path;
        if (relative.startsWith("errors/")) {
            sendJson(exchange, 200, results.errorsBySession(relative.substring("errors/".length())));
            return;
        }
        if (relative.isBlank() || relative.contains("/")) {
            throw new ValidationException("expected /results/{session_id} or /results/errors/{session_id}");
        }
        sendJson(exchange, 200, results.resultsBySession(relative));
    }

    private void handlePromptSettings(HttpServerExchange exchange, String correlationId) throws IOException {
        String method = exchange.getRequestMethod().toString();
        if ("GET".equalsIgnoreCase(method)) {
            sendJson(exchange, 200, mapper.convertValue(promptSettings.assessmentTemplates(), Map.class));
            return;
        }
        requireMethod(exchange, "PUT");
        PromptTemplates templates = mapper.treeToValue(readJsonBody(exchange), PromptTemplates.class);
        sendJson(exchange, 200, mapper.convertValue(promptSettings.saveAssessmentTemplates(templates), Map.class));
    }

    private void handleRubricPromptSettings(HttpServerExchange exchange, String correlationId) throws IOException {
        String method = exchange.getRequestMethod().toString();
        if ("GET".equalsIgnoreCase(method)) {
            sendJson(exchange, 200, mapper.convertValue(promptSettings.rubricTemplates(), Map.class));
            return;
        }
        requireMethod(exchange, "PUT");
        RubricPromptTemplates templates = mapper.treeToValue(readJsonBody(exchange), RubricPromptTemplates.class);
        sendJson(exchange, 200, mapper.convertValue(promptSettings.saveRubricTemplates(templates), Map.class));
    }

    private HttpHandler route(JsonRoute handler) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> runRoute(handler, exchange));
                return;
            }
            runRoute(handler, exchange);
        };
    }

    private void runRoute(JsonRoute handler, HttpServerExchange exchange) {
        String correlationId = header(exchange, "X-Request-ID");
        if (correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        exchange.getResponseHeaders().put(REQUEST_ID, correlationId);
        try {
            handler.handle(exchange, correlationId);
        } catch (MethodNotAllowed e) {
            sendError(exchange, 405, "METHOD_NOT_ALLOWED", e.getMessage(), Map.of(), correlationId);
        } catch (UpstreamException e) {
            LOG.warn("Upstream failure status={} correlation_id={}: {}", e.status(), correlationId, e.getMessage());
            if (e.status() == 429 && e.retryAfter() != null) {
                exchange.getResponseHeaders().put(RETRY_AFTER, e.retryAfter());
            }
            sendError(exchange, e.httpStatus(), e.code(), e.getMessage(), e.details(), correlationId);
        } catch (GradingException e) {
            if (e.httpStatus() >= 500) {
                LOG.error("Request failed correlation_id={}", correlationId, e);
            }
            sendError(exchange, e.httpStatus(), e.code(), e.getMessage(), e.details(), correlationId);
        } catch (JsonProcessingException e) {
            sendError(exchange, 422, "VALIDATION_ERROR", "Invalid JSON body: " + e.getOriginalMessage(), Map.of(), correlationId);
        } catch (Exception e) {
            LOG.error("Unhandled error correlation_id={}", correlationId, e);
            sendError(exchange, 500, "INTERNAL_ERROR", "Internal server error", Map.of(), correlationId);
        }
    }

    private void sendError(
        HttpServerExchange exchange,
        int status,
        String code,
        String message,
        Map<String, Object> details,
        String correlationId
    ) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message == null ? code : message);
        error.put("details", details == null ? Map.of() : details);
        error.put("correlation_id", correlationId);
        try {
            sendJson(exchange, status, Map.of("error", error));
        } catch (IOException e) {
            LOG.warn("Failed to send error response correlation_id={}", correlationId, e);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<?, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        JsonNode body = mapper.readTree(bytes);
        if (body == null || !body.isObject()) {
            throw new ValidationException("request body must be a JSON object");
        }
        return body;
    }

    private static void requireMethod(HttpServerExchange exchange, String method) {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            throw new MethodNotAllowed(exchange.getRequestMethod() + " not allowed on " + exchange.getRequestPath());
        }
    }

    private static String requiredText(JsonNode body, String field) {
        JsonNode value = body.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new ValidationException(field + " is required", Map.of("field", field));
        }
        return value.asText().trim();
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port, using {}", fallbackPort, e);
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface JsonRoute {
        void handle(HttpServerExchange exchange, String correlationId) throws Exception;
    }

    private static final class MethodNotAllowed extends RuntimeException {
        MethodNotAllowed(String message) {
            super(message);
        }
    }
}
