package io.markwise.core.model;

import java.util.Locale;

public enum SessionStatus {
    CREATED,
    GRADING,
    GRADED,
    FAILED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SessionStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return CREATED;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
