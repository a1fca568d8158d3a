package io.markwise.core.grading;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.model.ChatMessage;
import io.markwise.core.model.ContentPart;
import io.markwise.core.model.Question;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;

public final class PromptComposer {
    static final String QUESTION_LIST = "[Question list]";
    static final String RESPONSE_SCHEMA = "[Response schema]";
    static final String GRADING_RUBRIC = "[Grading rubric]";
    static final String STUDENT_ASSESSMENT = "[Student assessment]";
    static final String ANSWER_KEY = "[Answer key]";
    static final String RUBRIC_IMAGES = "[Rubric images]";

    private final ObjectMapper mapper;

    public PromptComposer() {
        this.mapper = new ObjectMapper();
    }

    public String questionList(List<Question> questions) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Question question : questions) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("question_number", question.questionId());
            entry.put("max_mark", question.maxMarks());
            entries.add(entry);
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(Map.of("question_list", entries));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize question list", e);
        }
    }

    public List<ChatMessage> assessmentMessages(
        PromptTemplates templates,
        List<String> studentUrls,
        List<String> answerKeyUrls,
        String questionList,
        String rubricText
    ) {
        String schema = templates.schemaTemplate().replace(QUESTION_LIST, questionList);
        String rubric = rubricText == null ? "" : rubricText;

        String system = templates.systemTemplate().replace(QUESTION_LIST, questionList);
        system = system.contains(RESPONSE_SCHEMA)
            ? system.replace(RESPONSE_SCHEMA, schema)
            : system + "\n\n" + schema;
        if (system.contains(GRADING_RUBRIC)) {
            system = system.replace(GRADING_RUBRIC, rubric);
        } else if (!rubric.isEmpty()) {
            system = system + "\n\nGrading rubric:\n" + rubric;
        }

        List<ContentPart> studentPages = imageParts(studentUrls);
        List<ContentPart> keyPages = imageParts(answerKeyUrls);
        Map<String, List<ContentPart>> placeholders = new LinkedHashMap<>();
        placeholders.put(STUDENT_ASSESSMENT, studentPages);
        placeholders.put(ANSWER_KEY, keyPages);
        placeholders.put(QUESTION_LIST, textPart(questionList));
        placeholders.put(RESPONSE_SCHEMA, textPart(schema));

        List<ContentPart> user = expand(templates.userTemplate(), placeholders);
        if (user == null) {
            user = new ArrayList<>();
            user.add(ContentPart.text(templates.userTemplate()));
            if (!studentPages.isEmpty()) {
                user.add(ContentPart.text("\n\nStudent test pages:"));
                user.addAll(studentPages);
            }
            if (!keyPages.isEmpty()) {
                user.add(ContentPart.text("\n\nAnswer key images:"));
                user.addAll(keyPages);
            }
        }
        return List.of(ChatMessage.system(system), ChatMessage.user(user));
    }

    public List<ChatMessage> rubricMessages(RubricPromptTemplates templates, List<String> rubricUrls, String questionList) {
        String system = templates.systemTemplate().replace(QUESTION_LIST, questionList);
        List<ContentPart> rubricPages = imageParts(rubricUrls);

        Map<String, List<ContentPart>> placeholders = new LinkedHashMap<>();
        placeholders.put(RUBRIC_IMAGES, rubricPages);
        placeholders.put(QUESTION_LIST, textPart(questionList));

        List<ContentPart> user = expand(templates.userTemplate(), placeholders);
        if (user == null) {
            user = new ArrayList<>();
            user.add(ContentPart.text(templates.userTemplate()));
            user.addAll(rubricPages);
        }
        return List.of(ChatMessage.system(system), ChatMessage.user(user));
    }

    static List<ContentPart> expand(String template, Map<String, List<ContentPart>> placeholders) {
        List<Occurrence> occurrences = new ArrayList<>();
        for (String placeholder : placeholders.keySet()) {
            int index = template.indexOf(placeholder);
            while (index >= 0) {
                occurrences.add(new Occurrence(index, placeholder));
                index = template.indexOf(placeholder, index + placeholder.length());
            }
        }
        if (occurrences.isEmpty()) {
            return null;
        }
        occurrences.sort(Comparator.comparingInt(Occurrence::index));

        List<ContentPart> parts = new ArrayList<>();
        int position = 0;
        for (Occurrence occurrence : occurrences) {
            if (occurrence.index() < position) {
                continue;
            }
            String before = template.substring(position, occurrence.index());
            if (!before.isBlank()) {
                parts.add(ContentPart.text(before));
            }
            parts.addAll(placeholders.get(occurrence.placeholder()));
            position = occurrence.index() + occurrence.placeholder().length();
        }
        String after = template.substring(position);
        if (!after.isBlank()) {
            parts.add(ContentPart.text(after));
        }
        return parts;
    }

    public static String canonicalUrl(String url) {
        if (url == null) {
            return null;
        }
        HttpUrl parsed = HttpUrl.parse(url.trim());
        return parsed == null ? url : parsed.toString();
    }

    private static List<ContentPart> imageParts(List<String> urls) {
        List<ContentPart> parts = new ArrayList<>();
        if (urls == null) {
            return parts;
        }
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                parts.add(ContentPart.image(canonicalUrl(url)));
            }
        }
        return parts;
    }

    private static List<ContentPart> textPart(String text) {
        return text == null || text.isEmpty() ? List.of() : List.of(ContentPart.text(text));
    }

    private record Occurrence(int index, String placeholder) {
    }
}
