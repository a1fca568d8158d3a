package io.markwise.core.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.markwise.core.model.ParsedAnswer;
import io.markwise.core.model.ValidationError;
import io.markwise.core.provider.RawCompletion;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a completion into canonical per-question answers: extract the JSON object, decode it,
 * coerce it with the first decoder that recognises its shape, then keep the entries whose id is
 * text and whose mark is numeric or null.
 */
public final class ResponseNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(ResponseNormalizer.class);
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*[}\\]]");

    private final JsonObjectExtractor extractor;
    private final List<AnswerDecoder> decoders;
    private final ObjectMapper mapper;

    public ResponseNormalizer() {
        this(
            new JsonObjectExtractor(),
            List.of(new AnswerListDecoder(), new AnswerMapDecoder(), new ResultListDecoder(), new GradesMapDecoder()),
            new ObjectMapper()
        );
    }

    public ResponseNormalizer(JsonObjectExtractor extractor, List<AnswerDecoder> decoders, ObjectMapper mapper) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.decoders = List.copyOf(Objects.requireNonNull(decoders, "decoders must not be null"));
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public NormalizedResponse normalize(RawCompletion completion) {
        return fromExtraction(extractor.fromCompletion(completion));
    }

    public NormalizedResponse normalizeText(String text) {
        return fromExtraction(extractor.fromText(text));
    }

    private NormalizedResponse fromExtraction(JsonObjectExtractor.Extraction extraction) {
        if (!extraction.found()) {
            return failed(extraction.error());
        }

        JsonNode decoded;
        try {
            decoded = mapper.readTree(extraction.json());
        } catch (JsonProcessingException e) {
            return failed(parseError(extraction.json(), e));
        }
        if (decoded == null || !decoded.isObject()) {
            return failed(ValidationError.of("answers_not_list"));
        }

        ObjectNode document = decodeEmbeddedAnswers((ObjectNode) decoded);
        Optional<List<AnswerCandidate>> candidates = Optional.empty();
        for (AnswerDecoder decoder : decoders) {
            candidates = decoder.decode(document);
            if (candidates.isPresent()) {
                break;
            }
        }
        if (candidates.isEmpty()) {
            return failed(ValidationError.of("answers_not_list"));
        }

        List<ParsedAnswer> answers = new ArrayList<>();
        for (AnswerCandidate candidate : candidates.get()) {
            toAnswer(candidate).ifPresent(answers::add);
        }
        if (answers.isEmpty()) {
            return failed(ValidationError.of("no_valid_answers"));
        }
        return NormalizedResponse.of(answers);
    }

    // "answers" sometimes arrives as a JSON document serialized into a string
    private ObjectNode decodeEmbeddedAnswers(ObjectNode document) {
        JsonNode answers = document.get("answers");
        if (answers == null || !answers.isTextual()) {
            return document;
        }
        try {
            JsonNode inner = mapper.readTree(answers.asText());
            if (inner != null && (inner.isArray() || inner.isObject())) {
                ObjectNode copy = document.deepCopy();
                copy.set("answers", inner);
                return copy;
            }
        } catch (JsonProcessingException e) {
            LOG.debug("answers field is a string that is not JSON: {}", e.getOriginalMessage());
        }
        return document;
    }

    private Optional<ParsedAnswer> toAnswer(AnswerCandidate candidate) {
        if (!candidate.questionId().isTextual()) {
            return Optional.empty();
        }
        JsonNode marks = candidate.marks();
        Double marksAwarded;
        if (marks.isMissingNode() || marks.isNull()) {
            marksAwarded = null;
        } else if (marks.isNumber()) {
            marksAwarded = marks.doubleValue();
        } else {
            return Optional.empty();
        }
        JsonNode notes = candidate.notes();
        String rubricNotes;
        if (notes.isMissingNode() || notes.isNull()) {
            rubricNotes = null;
        } else if (notes.isTextual()) {
            rubricNotes = notes.asText();
        } else {
            rubricNotes = notes.toString();
        }
        return Optional.of(new ParsedAnswer(candidate.questionId().asText(), marksAwarded, rubricNotes));
    }

    private ValidationError parseError(String json, JsonProcessingException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", String.valueOf(e.getOriginalMessage()));
        details.put("preview", JsonObjectExtractor.preview(json));
        List<String> hints = new ArrayList<>();
        if (TRAILING_COMMA.matcher(json).find()) {
            hints.add("trailing_comma");
        }
        if (hasUnterminatedString(json)) {
            hints.add("unterminated_string");
        }
        if (!hints.isEmpty()) {
            details.put("hints", hints);
        }
        return ValidationError.of("parse_exception", details);
    }

    private static boolean hasUnterminatedString(String json) {
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\' && inString) {
                escaped = true;
            } else if (c == '"') {
                inString = !inString;
            }
        }
        return inString;
    }

    private NormalizedResponse failed(ValidationError error) {
        LOG.debug("Completion could not be normalized: {}", error.reason());
        return NormalizedResponse.failed(error);
    }
}
