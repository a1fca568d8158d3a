package io.markwise.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class GradesMapDecoder implements AnswerDecoder {

    @Override
    public Optional<List<AnswerCandidate>> decode(ObjectNode document) {
        if (ResultListDecoder.hasAnswers(document)) {
            return Optional.empty();
        }
        JsonNode grades = document.has("results") ? document.get("results") : document.get("grades");
        if (grades == null || !grades.isObject()) {
            return Optional.empty();
        }
        List<AnswerCandidate> candidates = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = grades.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isObject()) {
                candidates.add(AnswerCandidate.keyed(
                    field.getKey(),
                    field.getValue(),
                    AnswerCandidate.GRADES_MARKS_KEYS,
                    AnswerCandidate.GRADES_NOTES_KEYS
                ));
            }
        }
        return Optional.of(candidates);
    }
}
