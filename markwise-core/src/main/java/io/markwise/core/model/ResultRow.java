package io.markwise.core.model;

import java.util.Objects;

public record ResultRow(
    String sessionId,
    String questionId,
    String modelName,
    int tryIndex,
    Double marksAwarded,
    String rubricNotes,
    String rawOutput,
    ValidationError validationError
) {

    public ResultRow {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(questionId, "questionId must not be null");
        Objects.requireNonNull(modelName, "modelName must not be null");
    }

    public static ResultRow answer(String sessionId, String modelName, int tryIndex, ParsedAnswer answer, String rawOutput) {
        return new ResultRow(
            sessionId,
            answer.questionId(),
            modelName,
            tryIndex,
            answer.marksAwarded(),
            answer.rubricNotes(),
            rawOutput,
            null
        );
    }

    public static ResultRow sentinel(
        String sessionId,
        SentinelQuestion sentinel,
        String modelName,
        int tryIndex,
        String rawOutput,
        ValidationError error
    ) {
        return new ResultRow(sessionId, sentinel.questionId(), modelName, tryIndex, null, null, rawOutput, error);
    }

    public Key key() {
        return new Key(sessionId, questionId, modelName, tryIndex);
    }

    public boolean sentinel() {
        return SentinelQuestion.isSentinel(questionId);
    }

    public record Key(String sessionId, String questionId, String modelName, int tryIndex) {
    }
}
