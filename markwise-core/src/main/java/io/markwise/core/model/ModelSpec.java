package io.markwise.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelSpec(
    String name,
    Integer tries,
    Map<String, Object> reasoning,
    @JsonProperty("instance_id") String instanceId
) {

    public static ModelSpec of(String name) {
        return new ModelSpec(name, null, null, null);
    }
}
