package io.markwise.core.normalize;

import io.markwise.core.model.ParsedAnswer;
import io.markwise.core.model.ValidationError;
import java.util.List;

public record NormalizedResponse(List<ParsedAnswer> answers, ValidationError error) {

    public NormalizedResponse {
        answers = answers == null ? List.of() : List.copyOf(answers);
    }

    public static NormalizedResponse of(List<ParsedAnswer> answers) {
        return new NormalizedResponse(answers, null);
    }

    public static NormalizedResponse failed(ValidationError error) {
        return new NormalizedResponse(List.of(), error);
    }

    public boolean ok() {
        return error == null && !answers.isEmpty();
    }
}
