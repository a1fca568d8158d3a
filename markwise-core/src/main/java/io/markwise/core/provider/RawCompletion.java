package io.markwise.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Objects;

public record RawCompletion(JsonNode body) {

    public RawCompletion {
        Objects.requireNonNull(body, "body must not be null");
    }

    public JsonNode choices() {
        return body.path("choices");
    }

    public JsonNode firstMessage() {
        JsonNode choices = choices();
        if (!choices.isArray() || choices.isEmpty()) {
            return MissingNode.getInstance();
        }
        return choices.path(0).path("message");
    }

    public JsonNode usage() {
        return body.path("usage");
    }

    public String model() {
        JsonNode model = body.path("model");
        return model.isTextual() ? model.asText() : null;
    }

    public String finishReason() {
        JsonNode reason = choices().path(0).path("finish_reason");
        return reason.isTextual() ? reason.asText() : null;
    }

    public String json() {
        return body.toString();
    }
}
