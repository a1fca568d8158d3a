package io.markwise.core.error;

public final class ConfigException extends GradingException {

    public ConfigException(String message) {
        super(500, "CONFIG_ERROR", message);
    }
}
