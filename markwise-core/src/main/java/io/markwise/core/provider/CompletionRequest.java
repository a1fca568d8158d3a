package io.markwise.core.provider;

import io.markwise.core.model.ChatMessage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record CompletionRequest(
    String model,
    List<ChatMessage> messages,
    Map<String, Object> reasoning,
    String sessionId,
    String instanceId,
    int tryIndex
) {

    public CompletionRequest {
        Objects.requireNonNull(model, "model must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        reasoning = reasoning == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(reasoning));
    }

    public static CompletionRequest of(String model, List<ChatMessage> messages) {
        return new CompletionRequest(model, messages, Map.of(), null, null, 0);
    }
}
