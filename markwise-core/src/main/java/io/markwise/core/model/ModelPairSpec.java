package io.markwise.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelPairSpec(
    @JsonProperty("rubric_model") ModelSpec rubricModel,
    @JsonProperty("assessment_model") ModelSpec assessmentModel,
    @JsonProperty("instance_id") String instanceId
) {
}
