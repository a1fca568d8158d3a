package io.markwise.core.error;

import java.util.Map;

public class GradingException extends RuntimeException {
    private final int httpStatus;
    private final String code;
    private final Map<String, Object> details;

    public GradingException(int httpStatus, String code, String message) {
        this(httpStatus, code, message, Map.of(), null);
    }

    public GradingException(int httpStatus, String code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.code = code == null || code.isBlank() ? "INTERNAL_ERROR" : code;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }
}
