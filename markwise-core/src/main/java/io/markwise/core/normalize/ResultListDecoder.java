package io.markwise.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class ResultListDecoder implements AnswerDecoder {

    @Override
    public Optional<List<AnswerCandidate>> decode(ObjectNode document) {
        if (hasAnswers(document)) {
            return Optional.empty();
        }
        JsonNode result = document.get("result");
        if (result == null || !result.isArray()) {
            return Optional.empty();
        }
        List<AnswerCandidate> combined = new ArrayList<>();
        for (JsonNode student : result) {
            JsonNode answers = student.path("answers");
            if (!answers.isArray()) {
                continue;
            }
            for (JsonNode entry : answers) {
                if (entry.isObject()) {
                    combined.add(AnswerCandidate.fromEntry(entry));
                }
            }
        }
        return combined.isEmpty() ? Optional.empty() : Optional.of(combined);
    }

    static boolean hasAnswers(ObjectNode document) {
        JsonNode answers = document.get("answers");
        return answers != null && !answers.isNull();
    }
}
