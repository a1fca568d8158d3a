package io.markwise.core.model;

import java.util.Objects;

public record RubricResultRow(
    String sessionId,
    String modelName,
    int tryIndex,
    String rubricResponse,
    String rawOutput,
    ValidationError validationError
) {

    public RubricResultRow {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(modelName, "modelName must not be null");
    }
}
