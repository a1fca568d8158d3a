package io.markwise.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.error.ConfigException;
import io.markwise.core.error.UpstreamException;
import io.markwise.core.model.ChatMessage;
import io.markwise.core.model.ContentPart;
import io.markwise.core.model.MessageRole;
import io.markwise.core.retry.RetryPolicy;
import io.markwise.core.retry.Sleeper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OpenRouterClient implements CompletionClient {
    private static final Logger LOG = LoggerFactory.getLogger(OpenRouterClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(2);
    private static final int BODY_EXCERPT_LIMIT = 1000;

    private final String apiKey;
    private final HttpUrl apiBase;
    private final Map<String, String> extraHeaders;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final SessionAuditLog auditLog;
    private final boolean debug;

    public OpenRouterClient(String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(
            apiKey,
            apiBase,
            extraHeaders,
            Duration.ofSeconds(60),
            RetryPolicy.completionDefaults(),
            Sleeper.system(),
            null,
            false
        );
    }

    public OpenRouterClient(
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        Duration callTimeout,
        RetryPolicy retryPolicy,
        Sleeper sleeper,
        SessionAuditLog auditLog,
        boolean debug
    ) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.auditLog = auditLog;
        this.debug = debug;
        this.client = new OkHttpClient.Builder()
            .callTimeout(callTimeout == null ? Duration.ofSeconds(60) : callTimeout)
            .connectTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public void verifyConfigured() {
        if (apiKey.isBlank()) {
            throw new ConfigException("OPENROUTER_API_KEY not configured");
        }
    }

    @Override
    public RawCompletion complete(CompletionRequest request) {
        verifyConfigured();
        String model = ProviderRouting.resolveModel(request.model());
        String payload = serialize(buildPayload(model, request));
        HttpUrl url = completionsUrl();

        audit(request, "REQUEST model=" + model + labels(request) + " url=" + url + "\n" + payload);
        if (debug) {
            LOG.info("OpenRouter request model={} instance={} try={} payload={}", model, request.instanceId(), request.tryIndex(), payload);
        } else {
            LOG.debug("OpenRouter request model={} instance={} try={}", model, request.instanceId(), request.tryIndex());
        }

        for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
            boolean finalAttempt = retryPolicy.isFinalAttempt(attempt);
            try (Response response = client.newCall(buildRequest(url, payload)).execute()) {
                String body = readBody(response.body());
                audit(request, "RESPONSE model=" + model + labels(request) + " status=" + response.code() + "\n" + body);

                if (response.code() == 429) {
                    String retryAfter = response.header("Retry-After");
                    String effective = retryAfter == null || retryAfter.isBlank() ? "2" : retryAfter.trim();
                    LOG.warn("OpenRouter rate limited model={} attempt={} retry-after={}", model, attempt + 1, effective);
                    if (finalAttempt) {
                        throw new UpstreamException(429, "OpenRouter rate limited", effective, excerpt(body));
                    }
                    sleep(RetryPolicy.scaled(parseRetryAfter(effective), attempt));
                    continue;
                }

                if (!response.isSuccessful()) {
                    LOG.warn("OpenRouter HTTP {} model={} attempt={}: {}", response.code(), model, attempt + 1, excerpt(body));
                    if (finalAttempt) {
                        throw new UpstreamException(
                            response.code(),
                            "OpenRouter returned HTTP " + response.code(),
                            null,
                            excerpt(body)
                        );
                    }
                    sleep(retryPolicy.backoff(attempt));
                    continue;
                }

                return parseCompletion(request, model, response.code(), body);
            } catch (IOException e) {
                LOG.warn("OpenRouter call failed model={} attempt={}: {}", model, attempt + 1, e.getMessage());
                if (finalAttempt || !retryPolicy.isRetryable(e)) {
                    throw new UpstreamException(502, "OpenRouter request failed: " + e.getMessage(), null, "", e);
                }
                sleep(retryPolicy.backoff(attempt));
            }
        }
        throw new UpstreamException(500, "OpenRouter request failed after retries", null, "");
    }

    private Map<String, Object> buildPayload(String model, CompletionRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("provider", ProviderRouting.providerPreferences(model));
        if (!request.reasoning().isEmpty()) {
            payload.put("reasoning", request.reasoning());
        }
        return payload;
    }

    private Request buildRequest(HttpUrl url, String payload) {
        Request.Builder builder = new Request.Builder()
            .url(url)
            .post(RequestBody.create(payload, JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");

        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            if (header.getValue() != null && !header.getValue().isBlank()) {
                builder.header(header.getKey(), header.getValue());
            }
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            if (message.role() == MessageRole.USER) {
                row.put("content", toWireParts(message.content()));
            } else {
                row.put("content", message.text());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireParts(List<ContentPart> parts) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ContentPart part : parts) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", part.type());
            if (part.isImage()) {
                item.put("image_url", Map.of("url", part.imageUrl(), "detail", "high"));
            } else {
                item.put("text", part.text());
            }
            wire.add(item);
        }
        return wire;
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }

    private RawCompletion parseCompletion(CompletionRequest request, String model, int status, String body) {
        try {
            JsonNode root = mapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new UpstreamException(502, "OpenRouter returned a non-object body", null, excerpt(body));
            }
            return new RawCompletion(root);
        } catch (JsonProcessingException e) {
            LOG.error("OpenRouter returned invalid JSON model={} status={} length={}", model, status, body.length());
            audit(request, "JSON_PARSE_ERROR model=" + model + " status=" + status + "\nResponse:\n" + body);
            throw new UpstreamException(
                502,
                "OpenRouter returned invalid JSON. Response starts with: " + truncate(body, 100),
                null,
                excerpt(body),
                e
            );
        }
    }

    private String serialize(Map<String, Object> payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize completion payload", e);
        }
    }

    private String readBody(ResponseBody body) throws IOException {
        return body == null ? "" : body.string();
    }

    private Duration parseRetryAfter(String value) {
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER;
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER;
        }
    }

    private void sleep(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(500, "Interrupted while waiting to retry OpenRouter call", null, "", ie);
        }
    }

    private void audit(CompletionRequest request, String text) {
        if (auditLog != null) {
            auditLog.append(request.sessionId(), text);
        }
    }

    private String labels(CompletionRequest request) {
        String instance = request.instanceId() == null ? "" : request.instanceId();
        String tryIndex = request.tryIndex() > 0 ? String.valueOf(request.tryIndex()) : "";
        return " instance_id=" + instance + " try=" + tryIndex;
    }

    private static String excerpt(String body) {
        return truncate(body, BODY_EXCERPT_LIMIT);
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
