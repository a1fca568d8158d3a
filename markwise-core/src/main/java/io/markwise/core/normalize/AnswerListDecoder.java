package io.markwise.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class AnswerListDecoder implements AnswerDecoder {

    @Override
    public Optional<List<AnswerCandidate>> decode(ObjectNode document) {
        JsonNode answers = document.get("answers");
        if (answers == null || !answers.isArray()) {
            return Optional.empty();
        }
        List<AnswerCandidate> candidates = new ArrayList<>();
        for (JsonNode entry : answers) {
            if (entry.isObject()) {
                candidates.add(AnswerCandidate.fromEntry(entry));
            }
        }
        return Optional.of(candidates);
    }
}
