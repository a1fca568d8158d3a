package io.markwise.cli;

import io.markwise.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Initialize or refresh config and the session log directory")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Overwrite existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Overwrote config with defaults: " + result.configPath());
            } else {
                System.out.println("Refreshed config with new defaults: " + result.configPath());
            }
            System.out.println("Session logs: " + result.logDirectory());
            System.out.println("Grading database: " + result.databasePath()
                + (result.databaseExists() ? " (existing sessions kept)" : " (created on first serve or grade)"));
            if (!context.configService().loadEffective(context.configPath(), context.environment()).openrouter().configured()) {
                System.out.println("Set openrouter.apiKey in the config or export OPENROUTER_API_KEY before grading.");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
