package io.markwise.core.grading;

import io.markwise.core.model.SessionStatus;
import java.util.LinkedHashMap;
import java.util.Map;

public record GradeOutcome(
    String sessionId,
    int workItems,
    int succeeded,
    int failed,
    int rowsWritten,
    SessionStatus status
) {

    public Map<String, Object> toResponse() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("session_id", sessionId);
        return body;
    }
}
