package io.markwise.core.model;

/**
 * Reserved question ids that mark a failed work item inside the result table. They share the
 * column with real question ids, so a question literally named like one of these would collide.
 */
public enum SentinelQuestion {
    PARSE_ERROR("__parse_error__"),
    RUBRIC_ERROR("__rubric_error__");

    private final String questionId;

    SentinelQuestion(String questionId) {
        this.questionId = questionId;
    }

    public String questionId() {
        return questionId;
    }

    public static boolean isSentinel(String questionId) {
        for (SentinelQuestion sentinel : values()) {
            if (sentinel.questionId.equals(questionId)) {
                return true;
            }
        }
        return false;
    }
}
