package io.markwise.core.model;

import java.util.Objects;

public record SessionImage(String sessionId, ImageRole role, String url, int orderIndex) {

    public SessionImage {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(url, "url must not be null");
    }
}
