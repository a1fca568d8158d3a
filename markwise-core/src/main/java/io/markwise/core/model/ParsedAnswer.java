package io.markwise.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

public record ParsedAnswer(
    @JsonProperty("question_id") String questionId,
    @JsonProperty("marks_awarded") Double marksAwarded,
    @JsonProperty("rubric_notes") String rubricNotes
) {

    public ParsedAnswer {
        Objects.requireNonNull(questionId, "questionId must not be null");
    }
}
