package io.markwise.core.model;

import java.util.Locale;

public enum ImageRole {
    STUDENT,
    ANSWER_KEY,
    GRADING_RUBRIC;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ImageRole fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("image role must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
