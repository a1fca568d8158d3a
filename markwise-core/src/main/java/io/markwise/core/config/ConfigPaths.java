package io.markwise.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".markwise", "config.json");
    }

    public static Path resolve(String rawPath, String fallback) {
        String value = rawPath == null || rawPath.isBlank() ? fallback : rawPath;
        if (value.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(value.substring(2));
        }
        return Path.of(value);
    }
}
