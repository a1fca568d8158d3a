package io.markwise.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record WorkItem(
    String rubricModel,
    String assessmentModel,
    int tryIndex,
    Map<String, Object> rubricReasoning,
    Map<String, Object> assessmentReasoning,
    String instanceId
) {

    public WorkItem {
        Objects.requireNonNull(assessmentModel, "assessmentModel must not be null");
        Objects.requireNonNull(instanceId, "instanceId must not be null");
        if (tryIndex < 1) {
            throw new IllegalArgumentException("tryIndex must be >= 1");
        }
        rubricReasoning = rubricReasoning == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rubricReasoning));
        assessmentReasoning = assessmentReasoning == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(assessmentReasoning));
    }

    public boolean rubricConditioned() {
        return rubricModel != null;
    }
}
