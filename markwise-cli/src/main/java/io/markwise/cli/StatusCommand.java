package io.markwise.cli;

import io.markwise.core.config.ConfigPaths;
import io.markwise.core.config.model.MarkwiseConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show runtime and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MarkwiseConfig config = context.configService().loadEffective(context.configPath(), context.environment());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + ConfigPaths.resolve(config.storage().dbPath(), "~/.markwise/markwise.db"));
            System.out.println("Session logs: " + ConfigPaths.resolve(config.grading().logDir(), "~/.markwise/logs"));
            System.out.println("OpenRouter base: " + config.openrouter().apiBase());
            System.out.println("OpenRouter configured: " + config.openrouter().configured());
            System.out.println("Max concurrency: " + config.grading().maxConcurrency());
            System.out.println("Default tries: " + config.grading().defaultTries());
            System.out.println("Debug logging: " + config.grading().debug());
            System.out.println("Gateway: " + config.gateway().host() + ":" + config.gateway().port());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
