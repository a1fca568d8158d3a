package io.markwise.core.error;

public final class NotFoundException extends GradingException {

    public NotFoundException(String message) {
        super(404, "NOT_FOUND", message);
    }
}
