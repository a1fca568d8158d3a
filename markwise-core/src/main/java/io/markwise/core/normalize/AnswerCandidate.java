package io.markwise.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;

public record AnswerCandidate(JsonNode questionId, JsonNode marks, JsonNode notes) {
    static final List<String> QUESTION_ID_KEYS =
        List.of("question_id", "qid", "questionID", "question", "question_number");
    static final List<String> MARKS_KEYS = List.of("marks_awarded", "mark", "score");
    static final List<String> NOTES_KEYS = List.of("rubric_notes", "feedback", "notes");
    // keyed entries prefer the short names
    static final List<String> KEYED_MARKS_KEYS = List.of("mark", "marks_awarded", "score");
    static final List<String> KEYED_NOTES_KEYS = List.of("feedback", "rubric_notes", "notes");
    static final List<String> GRADES_MARKS_KEYS = List.of("mark", "marks_awarded");
    static final List<String> GRADES_NOTES_KEYS = List.of("feedback", "rubric_notes");

    public AnswerCandidate {
        questionId = questionId == null ? MissingNode.getInstance() : questionId;
        marks = marks == null ? MissingNode.getInstance() : marks;
        notes = notes == null ? MissingNode.getInstance() : notes;
    }

    static AnswerCandidate fromEntry(JsonNode entry) {
        return new AnswerCandidate(
            firstNonEmpty(entry, QUESTION_ID_KEYS),
            firstPresent(entry, MARKS_KEYS),
            firstPresent(entry, NOTES_KEYS)
        );
    }

    static AnswerCandidate keyed(String questionId, JsonNode value) {
        return keyed(questionId, value, KEYED_MARKS_KEYS, KEYED_NOTES_KEYS);
    }

    static AnswerCandidate keyed(String questionId, JsonNode value, List<String> marksKeys, List<String> notesKeys) {
        return new AnswerCandidate(
            TextNode.valueOf(questionId),
            firstPresent(value, marksKeys),
            firstPresent(value, notesKeys)
        );
    }

    static JsonNode firstPresent(JsonNode entry, List<String> keys) {
        for (String key : keys) {
            JsonNode value = entry.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return MissingNode.getInstance();
    }

    private static JsonNode firstNonEmpty(JsonNode entry, List<String> keys) {
        for (String key : keys) {
            JsonNode value = entry.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isTextual() && value.asText().isEmpty()) {
                continue;
            }
            return value;
        }
        return MissingNode.getInstance();
    }
}
