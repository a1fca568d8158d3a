package io.markwise.core.config;

import java.nio.file.Path;

public record OnboardResult(
    Path configPath,
    Path logDirectory,
    Path databasePath,
    boolean databaseExists,
    boolean createdConfig,
    boolean overwrittenConfig
) {
}
