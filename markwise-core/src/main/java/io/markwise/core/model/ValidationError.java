package io.markwise.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ValidationError(String reason, Map<String, Object> details) {

    public ValidationError {
        Objects.requireNonNull(reason, "reason must not be null");
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ValidationError of(String reason) {
        return new ValidationError(reason, Map.of());
    }

    public static ValidationError of(String reason, Map<String, Object> details) {
        return new ValidationError(reason, details);
    }

    public static ValidationError fromMap(Map<String, Object> raw) {
        Map<String, Object> details = new LinkedHashMap<>(raw);
        Object reason = details.remove("reason");
        details.values().removeIf(Objects::isNull);
        return new ValidationError(reason == null ? "unknown" : String.valueOf(reason), details);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("reason", reason);
        map.putAll(details);
        return map;
    }
}
