package io.markwise.core.error;

import java.util.Map;

public final class PersistenceException extends GradingException {

    public PersistenceException(String message, Throwable cause) {
        super(500, "PERSISTENCE_ERROR", message, Map.of(), cause);
    }
}
