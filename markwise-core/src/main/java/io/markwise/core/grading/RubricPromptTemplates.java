package io.markwise.core.grading;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RubricPromptTemplates(
    @JsonProperty("system_template") String systemTemplate,
    @JsonProperty("user_template") String userTemplate
) {
    public static final String SETTINGS_KEY = "rubric_prompt_settings";

    static final String DEFAULT_SYSTEM = """
        You turn scanned grading rubric pages into structured grading criteria.
        Cover every question in this list:
        [Question list]

        Return ONLY JSON with this exact schema (no markdown fences, no prose):
        {"grading_criteria":[{"question_id":string,"max_marks":number,"grading_criteria":[string],"deductions":[string],"notes":string}]}
        Use the question_number values of the question list as question_id, exactly as provided.""";

    static final String DEFAULT_USER = """
        Here are the grading rubric pages:
        [Rubric images]""";

    public static RubricPromptTemplates defaults() {
        return new RubricPromptTemplates(DEFAULT_SYSTEM, DEFAULT_USER);
    }

    public RubricPromptTemplates withDefaults() {
        return new RubricPromptTemplates(
            PromptTemplates.isBlank(systemTemplate) ? DEFAULT_SYSTEM : systemTemplate,
            PromptTemplates.isBlank(userTemplate) ? DEFAULT_USER : userTemplate
        );
    }

    public boolean complete() {
        return !PromptTemplates.isBlank(systemTemplate) && !PromptTemplates.isBlank(userTemplate);
    }
}
