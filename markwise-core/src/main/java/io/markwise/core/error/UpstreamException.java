package io.markwise.core.error;

import java.util.LinkedHashMap;
import java.util.Map;

public final class UpstreamException extends GradingException {
    private final String retryAfter;
    private final String bodyExcerpt;

    public UpstreamException(int status, String message, String retryAfter, String bodyExcerpt) {
        this(status, message, retryAfter, bodyExcerpt, null);
    }

    public UpstreamException(int status, String message, String retryAfter, String bodyExcerpt, Throwable cause) {
        super(status, "UPSTREAM_ERROR", message, details(bodyExcerpt), cause);
        this.retryAfter = retryAfter;
        this.bodyExcerpt = bodyExcerpt == null ? "" : bodyExcerpt;
    }

    public int status() {
        return httpStatus();
    }

    public String retryAfter() {
        return retryAfter;
    }

    public String bodyExcerpt() {
        return bodyExcerpt;
    }

    private static Map<String, Object> details(String bodyExcerpt) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (bodyExcerpt != null && !bodyExcerpt.isEmpty()) {
            details.put("openrouter_body", bodyExcerpt);
        }
        return details;
    }
}
