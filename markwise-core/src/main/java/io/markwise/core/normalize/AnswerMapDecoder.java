package io.markwise.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class AnswerMapDecoder implements AnswerDecoder {

    @Override
    public Optional<List<AnswerCandidate>> decode(ObjectNode document) {
        JsonNode answers = document.get("answers");
        if (answers == null || !answers.isObject()) {
            return Optional.empty();
        }
        List<AnswerCandidate> candidates = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = answers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                candidates.add(AnswerCandidate.keyed(field.getKey(), value));
            } else if (value.isNumber()) {
                candidates.add(new AnswerCandidate(TextNode.valueOf(field.getKey()), value, MissingNode.getInstance()));
            } else if (value.isTextual()) {
                candidates.add(new AnswerCandidate(TextNode.valueOf(field.getKey()), MissingNode.getInstance(), value));
            }
        }
        return Optional.of(candidates);
    }
}
