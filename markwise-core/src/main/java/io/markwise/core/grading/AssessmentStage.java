package io.markwise.core.grading;

import io.markwise.core.model.ChatMessage;
import io.markwise.core.model.WorkItem;
import io.markwise.core.normalize.NormalizedResponse;
import io.markwise.core.normalize.ResponseNormalizer;
import io.markwise.core.provider.CompletionClient;
import io.markwise.core.provider.CompletionRequest;
import io.markwise.core.provider.RawCompletion;
import io.markwise.core.provider.SessionAuditLog;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AssessmentStage {
    private static final Logger LOG = LoggerFactory.getLogger(AssessmentStage.class);

    private final CompletionClient client;
    private final ConcurrencyLimiter limiter;
    private final ResponseNormalizer normalizer;
    private final SessionAuditLog auditLog;

    public AssessmentStage(
        CompletionClient client,
        ConcurrencyLimiter limiter,
        ResponseNormalizer normalizer,
        SessionAuditLog auditLog
    ) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.limiter = Objects.requireNonNull(limiter, "limiter must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.auditLog = auditLog;
    }

    public AssessmentOutcome run(
        String sessionId,
        WorkItem item,
        List<ChatMessage> messages,
        RubricOutcome rubric
    ) throws InterruptedException {
        CompletionRequest request = new CompletionRequest(
            item.assessmentModel(),
            messages,
            item.assessmentReasoning(),
            sessionId,
            item.instanceId(),
            item.tryIndex()
        );
        // only the remote call holds a permit; normalizing runs outside it
        RawCompletion completion = limiter.withPermit(() -> client.complete(request));
        NormalizedResponse normalized = normalizer.normalize(completion);

        if (normalized.ok()) {
            LOG.info("Graded model={} instance={} try={} answers={}",
                item.assessmentModel(), item.instanceId(), item.tryIndex(), normalized.answers().size());
            audit(sessionId, "PARSED instance_id=" + item.instanceId() + " try=" + item.tryIndex()
                + " answers=" + normalized.answers().size());
        } else {
            LOG.warn("Unusable answer model={} instance={} try={} reason={}",
                item.assessmentModel(), item.instanceId(), item.tryIndex(), normalized.error().reason());
            audit(sessionId, "PARSE_ERROR instance_id=" + item.instanceId() + " try=" + item.tryIndex()
                + " " + normalized.error().asMap());
        }
        return new AssessmentOutcome(item, completion, normalized, rubric);
    }

    private void audit(String sessionId, String text) {
        if (auditLog != null) {
            auditLog.append(sessionId, text);
        }
    }
}
