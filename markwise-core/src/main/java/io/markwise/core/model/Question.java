package io.markwise.core.model;

import java.util.Objects;

public record Question(String sessionId, String questionId, int number, double maxMarks) {

    public Question {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(questionId, "questionId must not be null");
    }
}
