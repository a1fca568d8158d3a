package io.markwise.core.model;

import java.time.Instant;
import java.util.Objects;

public record Session(String id, SessionStatus status, String modelConfig, Instant createdAt, Instant updatedAt) {

    public Session {
        Objects.requireNonNull(id, "id must not be null");
        status = status == null ? SessionStatus.CREATED : status;
    }
}
