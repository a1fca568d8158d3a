package io.markwise.core.grading;

import io.markwise.core.model.WorkItem;
import io.markwise.core.normalize.NormalizedResponse;
import io.markwise.core.provider.RawCompletion;

public record AssessmentOutcome(
    WorkItem item,
    RawCompletion completion,
    NormalizedResponse normalized,
    RubricOutcome rubric
) {

    public boolean hasAnswers() {
        return normalized.ok();
    }

    public boolean rubricFailed() {
        return rubric != null && !rubric.ok();
    }
}
