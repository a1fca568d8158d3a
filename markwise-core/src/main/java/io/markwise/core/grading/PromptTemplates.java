package io.markwise.core.grading;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Templates of the assessment prompt. Placeholders: {@code [Question list]},
 * {@code [Response schema]} and {@code [Grading rubric]} in the system text;
 * {@code [Student assessment]}, {@code [Answer key]}, {@code [Question list]} and
 * {@code [Response schema]} in the user text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptTemplates(
    @JsonProperty("system_template") String systemTemplate,
    @JsonProperty("user_template") String userTemplate,
    @JsonProperty("schema_template") String schemaTemplate
) {
    public static final String SETTINGS_KEY = "prompt_settings";

    static final String DEFAULT_SYSTEM = """
        <Role>
        You are a teacher whose job is to grade student assessments.
        </Role>

        <Task>
        You will be given the answer key pages, the list of questions to grade and the pages of one
        student's assessment. For each question in the list, assign `marks_awarded` (never more than
        its `max_mark`) and explain the decision in `rubric_notes`.
        </Task>

        <Question_List>
        Only grade these questions:
        [Question list]
        </Question_List>

        <Grading_Rubric>
        [Grading rubric]
        </Grading_Rubric>

        [Response schema]""";

    static final String DEFAULT_USER = """
        <Answer_Key>
        Here are the answer key pages:
        [Answer key]
        </Answer_Key>

        <Student_Assessment>
        Here are the pages of the student's test:
        [Student assessment]
        </Student_Assessment>""";

    static final String DEFAULT_SCHEMA = """
        Return ONLY JSON with this exact schema (no markdown fences, no prose):
        {"result":[{"first_name":string,"last_name":string,"answers":[{"question_id":string,"marks_awarded":number,"rubric_notes":string}]}]}
        Use the question_number values of the question list as question_id, exactly as provided.""";

    public static PromptTemplates defaults() {
        return new PromptTemplates(DEFAULT_SYSTEM, DEFAULT_USER, DEFAULT_SCHEMA);
    }

    public PromptTemplates withDefaults() {
        return new PromptTemplates(
            isBlank(systemTemplate) ? DEFAULT_SYSTEM : systemTemplate,
            isBlank(userTemplate) ? DEFAULT_USER : userTemplate,
            isBlank(schemaTemplate) ? DEFAULT_SCHEMA : schemaTemplate
        );
    }

    public boolean complete() {
        return !isBlank(systemTemplate) && !isBlank(userTemplate) && !isBlank(schemaTemplate);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
