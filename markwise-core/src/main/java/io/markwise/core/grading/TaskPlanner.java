package io.markwise.core.grading;

import io.markwise.core.error.ValidationException;
import io.markwise.core.model.GradeRequest;
import io.markwise.core.model.ModelPairSpec;
import io.markwise.core.model.ModelSpec;
import io.markwise.core.model.WorkItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class TaskPlanner {

    public List<WorkItem> plan(GradeRequest request) {
        boolean hasModels = !request.models().isEmpty();
        boolean hasPairs = !request.modelPairs().isEmpty();
        if (hasModels == hasPairs) {
            throw new ValidationException(hasModels
                ? "Provide either models or model_pairs, not both"
                : "Provide at least one entry in models or model_pairs");
        }
        return hasPairs ? planPairs(request) : planModels(request);
    }

    private List<WorkItem> planModels(GradeRequest request) {
        List<WorkItem> items = new ArrayList<>();
        for (ModelSpec spec : request.models()) {
            String name = requireName(spec, "models[].name");
            int tries = effectiveTries(spec.tries(), request.defaultTries());
            Map<String, Object> reasoning = resolveReasoning(spec.reasoning(), request.reasoning());
            String instanceId = isBlank(spec.instanceId()) ? name : spec.instanceId();
            for (int tryIndex = 1; tryIndex <= tries; tryIndex++) {
                items.add(new WorkItem(null, name, tryIndex, Map.of(), reasoning, instanceId));
            }
        }
        return items;
    }

    private List<WorkItem> planPairs(GradeRequest request) {
        List<WorkItem> items = new ArrayList<>();
        List<ModelPairSpec> pairs = request.modelPairs();
        for (int index = 0; index < pairs.size(); index++) {
            ModelPairSpec pair = pairs.get(index);
            if (pair == null || pair.rubricModel() == null || pair.assessmentModel() == null) {
                throw new ValidationException("model_pairs[" + index + "] needs rubric_model and assessment_model");
            }
            String rubric = requireName(pair.rubricModel(), "model_pairs[].rubric_model.name");
            String assessment = requireName(pair.assessmentModel(), "model_pairs[].assessment_model.name");

            Integer legTries = positive(pair.assessmentModel().tries()) != null
                ? pair.assessmentModel().tries()
                : pair.rubricModel().tries();
            int tries = effectiveTries(legTries, request.defaultTries());
            Map<String, Object> rubricReasoning = resolveReasoning(pair.rubricModel().reasoning(), request.reasoning());
            Map<String, Object> assessmentReasoning =
                resolveReasoning(pair.assessmentModel().reasoning(), request.reasoning());
            String instanceId = isBlank(pair.instanceId())
                ? "pair_" + index + "_" + rubric + "_" + assessment
                : pair.instanceId();

            for (int tryIndex = 1; tryIndex <= tries; tryIndex++) {
                items.add(new WorkItem(rubric, assessment, tryIndex, rubricReasoning, assessmentReasoning, instanceId));
            }
        }
        return items;
    }

    static int effectiveTries(Integer specTries, Integer defaultTries) {
        Integer chosen = positive(specTries) != null ? specTries : positive(defaultTries);
        return chosen == null ? 1 : Math.max(1, chosen);
    }

    // an empty object counts as absent, so it falls back to the request-level value
    static Map<String, Object> resolveReasoning(Map<String, Object> own, Map<String, Object> requestLevel) {
        if (own != null && !own.isEmpty()) {
            return own;
        }
        return requestLevel == null ? Map.of() : requestLevel;
    }

    private static Integer positive(Integer value) {
        return value != null && value > 0 ? value : null;
    }

    private static String requireName(ModelSpec spec, String field) {
        if (spec == null || isBlank(spec.name())) {
            throw new ValidationException(field + " must not be blank");
        }
        return spec.name().trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
