package io.markwise.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import io.markwise.core.model.ValidationError;
import io.markwise.core.provider.RawCompletion;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Locates the first balanced JSON object inside free-form model output.
 *
 * <p>Text parts of the first choice are joined with newlines. When the text holds a fenced code
 * block only its interior is scanned. From the first {@code '{'} a small state machine tracks
 * brace depth while skipping braces inside double-quoted strings. If the object never closes,
 * the last {@code '}'} in the text ends it instead.
 */
public final class JsonObjectExtractor {
    private static final String FENCE = "```";
    private static final int PREVIEW_LIMIT = 200;

    private enum ScanState {
        OUTSIDE_STRING,
        IN_STRING,
        AFTER_ESCAPE
    }

    public Extraction fromCompletion(RawCompletion completion) {
        JsonNode choices = completion.choices();
        if (!choices.isArray() || choices.isEmpty()) {
            return Extraction.failure(ValidationError.of("no_choices"));
        }
        JsonNode content = completion.firstMessage().path("content");
        String text;
        if (content.isTextual()) {
            text = content.asText();
        } else if (content.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode part : content) {
                if (part.isObject() && "text".equals(part.path("type").asText())) {
                    parts.add(part.path("text").asText(""));
                }
            }
            text = String.join("\n", parts);
        } else {
            return Extraction.failure(ValidationError.of("unsupported_content_type"));
        }
        return fromText(text);
    }

    public Extraction fromText(String rawText) {
        String text = rawText == null ? "" : rawText.strip();
        String scanned = fencedInterior(text);

        int start = scanned.indexOf('{');
        if (start < 0) {
            return Extraction.failure(ValidationError.of("no_json_in_content", Map.of("preview", preview(text))));
        }
        int end = matchingBrace(scanned, start);
        if (end < 0) {
            end = scanned.lastIndexOf('}');
        }
        if (end <= start) {
            return Extraction.failure(ValidationError.of("no_closing_brace", Map.of("preview", preview(text))));
        }
        return Extraction.success(scanned.substring(start, end + 1));
    }

    static String fencedInterior(String text) {
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return text;
        }
        int bodyStart = open + FENCE.length();
        int lineEnd = text.indexOf('\n', bodyStart);
        // the remainder of the opening line is a language tag such as "json"
        if (lineEnd >= 0 && text.substring(bodyStart, lineEnd).strip().matches("[A-Za-z0-9_+-]*")) {
            bodyStart = lineEnd + 1;
        }
        int close = text.indexOf(FENCE, bodyStart);
        String interior = close < 0 ? text.substring(bodyStart) : text.substring(bodyStart, close);
        return interior.strip();
    }

    static int matchingBrace(String text, int start) {
        ScanState state = ScanState.OUTSIDE_STRING;
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (state) {
                case OUTSIDE_STRING -> {
                    if (c == '"') {
                        state = ScanState.IN_STRING;
                    } else if (c == '{') {
                        depth++;
                    } else if (c == '}') {
                        depth--;
                        if (depth == 0) {
                            return i;
                        }
                    }
                }
                case IN_STRING -> {
                    if (c == '\\') {
                        state = ScanState.AFTER_ESCAPE;
                    } else if (c == '"') {
                        state = ScanState.OUTSIDE_STRING;
                    }
                }
                case AFTER_ESCAPE -> state = ScanState.IN_STRING;
            }
        }
        return -1;
    }

    static String preview(String text) {
        return text.length() <= PREVIEW_LIMIT ? text : text.substring(0, PREVIEW_LIMIT);
    }

    public record Extraction(String json, ValidationError error) {

        static Extraction success(String json) {
            return new Extraction(json, null);
        }

        static Extraction failure(ValidationError error) {
            return new Extraction(null, error);
        }

        public boolean found() {
            return json != null;
        }
    }
}
