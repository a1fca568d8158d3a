package io.markwise.cli;

import io.markwise.core.error.GradingException;
import io.markwise.core.grading.GradeOutcome;
import io.markwise.core.model.GradeRequest;
import io.markwise.core.model.ModelSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "grade", description = "Grade a prepared session with one or more models")
public final class GradeCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Option(names = {"-m", "--model"}, required = true, description = "Model to grade with (repeatable)")
    List<String> models = new ArrayList<>();

    @Option(names = {"-t", "--tries"}, description = "Tries per model (defaults to grading.default_tries)")
    Integer tries;

    @Option(names = {"--reasoning-effort"}, description = "Reasoning effort passed to every model (low, medium, high)")
    String reasoningEffort;

    public GradeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<ModelSpec> specs = new ArrayList<>();
            for (String model : models) {
                specs.add(ModelSpec.of(model));
            }
            Map<String, Object> reasoning = reasoningEffort == null || reasoningEffort.isBlank()
                ? null
                : Map.of("effort", reasoningEffort.trim());
            Integer effectiveTries = tries != null
                ? tries
                : context.configService().loadEffective(context.configPath(), context.environment()).grading().defaultTries();
            GradeOutcome outcome = context.engine().grade(
                new GradeRequest(sessionId, List.of(), specs, effectiveTries, reasoning)
            );
            System.out.println("Session " + outcome.sessionId() + " " + outcome.status().wireValue()
                + ": " + outcome.succeeded() + "/" + outcome.workItems() + " calls succeeded, "
                + outcome.rowsWritten() + " result rows written");
            return 0;
        } catch (GradingException e) {
            System.err.println("Grade failed [" + e.code() + "]: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Grade failed: " + e.getMessage());
            return 1;
        }
    }
}
