package io.markwise.core.error;

import java.util.Map;

public final class ValidationException extends GradingException {

    public ValidationException(String message) {
        this(message, Map.of());
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(422, "VALIDATION_ERROR", message, details, null);
    }
}
