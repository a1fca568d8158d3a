package io.markwise.core.grading;

import io.markwise.core.model.ValidationError;

public record RubricOutcome(String rubricText, ValidationError error) {

    public RubricOutcome {
        rubricText = rubricText == null ? "" : rubricText;
    }

    public boolean ok() {
        return error == null;
    }
}
