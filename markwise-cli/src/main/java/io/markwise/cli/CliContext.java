package io.markwise.cli;

import io.markwise.core.config.ConfigService;
import io.markwise.core.grading.GradingEngine;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    GradingEngine engine,
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    ServeRunner serveRunner
) {
    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public CliContext(GradingEngine engine, ConfigService configService, Path configPath) {
        this(engine, configService, configPath, Map.of(), (port, host) -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}
