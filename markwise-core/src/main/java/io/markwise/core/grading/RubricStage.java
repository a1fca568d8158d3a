package io.markwise.core.grading;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.model.ChatMessage;
import io.markwise.core.model.RubricResultRow;
import io.markwise.core.model.ValidationError;
import io.markwise.core.model.WorkItem;
import io.markwise.core.normalize.JsonObjectExtractor;
import io.markwise.core.provider.CompletionClient;
import io.markwise.core.provider.CompletionRequest;
import io.markwise.core.provider.RawCompletion;
import io.markwise.core.store.PersistenceCoordinator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RubricStage {
    private static final Logger LOG = LoggerFactory.getLogger(RubricStage.class);

    private final CompletionClient client;
    private final ConcurrencyLimiter limiter;
    private final JsonObjectExtractor extractor;
    private final PersistenceCoordinator persistence;
    private final ObjectMapper mapper;

    public RubricStage(
        CompletionClient client,
        ConcurrencyLimiter limiter,
        JsonObjectExtractor extractor,
        PersistenceCoordinator persistence
    ) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.limiter = Objects.requireNonNull(limiter, "limiter must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.persistence = Objects.requireNonNull(persistence, "persistence must not be null");
        this.mapper = new ObjectMapper();
    }

    public RubricOutcome run(String sessionId, WorkItem item, List<ChatMessage> messages) throws InterruptedException {
        CompletionRequest request = new CompletionRequest(
            item.rubricModel(),
            messages,
            item.rubricReasoning(),
            sessionId,
            item.instanceId() + ":rubric",
            item.tryIndex()
        );
        RawCompletion completion = limiter.withPermit(() -> client.complete(request));

        RubricOutcome outcome = validate(completion);
        persistence.persistRubricResult(new RubricResultRow(
            sessionId,
            item.instanceId(),
            item.tryIndex(),
            outcome.ok() ? outcome.rubricText() : null,
            completion.json(),
            outcome.error()
        ));
        if (outcome.ok()) {
            LOG.debug("Rubric extracted model={} instance={} try={}", item.rubricModel(), item.instanceId(), item.tryIndex());
        } else {
            LOG.warn("Rubric extraction failed model={} instance={} try={} reason={}",
                item.rubricModel(), item.instanceId(), item.tryIndex(), outcome.error().reason());
        }
        return outcome;
    }

    RubricOutcome validate(RawCompletion completion) {
        JsonObjectExtractor.Extraction extraction = extractor.fromCompletion(completion);
        if (!extraction.found()) {
            return new RubricOutcome("", extraction.error());
        }
        JsonNode document;
        try {
            document = mapper.readTree(extraction.json());
        } catch (JsonProcessingException e) {
            return new RubricOutcome("", ValidationError.of(
                "parse_exception",
                Map.of("error", String.valueOf(e.getOriginalMessage()))
            ));
        }
        if (document == null || !document.path("grading_criteria").isArray()) {
            return new RubricOutcome("", ValidationError.of("missing_grading_criteria"));
        }
        return new RubricOutcome(extraction.json(), null);
    }
}
