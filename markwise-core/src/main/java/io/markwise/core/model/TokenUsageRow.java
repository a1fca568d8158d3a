package io.markwise.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record TokenUsageRow(
    String sessionId,
    String modelName,
    int tryIndex,
    long inputTokens,
    long outputTokens,
    long reasoningTokens,
    long totalTokens,
    long cacheCreationInputTokens,
    long cacheReadInputTokens,
    String modelId,
    String finishReason,
    double costEstimate,
    Map<String, Object> metadata
) {

    public TokenUsageRow {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(modelName, "modelName must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
