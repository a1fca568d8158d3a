package io.markwise.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GradeRequest(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("model_pairs") List<ModelPairSpec> modelPairs,
    List<ModelSpec> models,
    @JsonProperty("default_tries") Integer defaultTries,
    Map<String, Object> reasoning
) {

    public GradeRequest {
        modelPairs = modelPairs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(modelPairs));
        models = models == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(models));
    }

    public static GradeRequest forModels(String sessionId, List<ModelSpec> models, Integer defaultTries) {
        return new GradeRequest(sessionId, List.of(), models, defaultTries, null);
    }

    public static GradeRequest forPairs(String sessionId, List<ModelPairSpec> pairs, Integer defaultTries) {
        return new GradeRequest(sessionId, pairs, List.of(), defaultTries, null);
    }

    public boolean rubricConditioned() {
        return !modelPairs.isEmpty();
    }
}
