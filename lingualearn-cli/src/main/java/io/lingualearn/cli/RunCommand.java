package io.lingualearn.cli;

import io.lingualearn.core.catalog.Catalog;
import io.lingualearn.core.concurrent.CancellationSignal;
import io.lingualearn.core.config.model.LinguaLearnConfig;
import io.lingualearn.core.execution.ExecutionOptions;
import io.lingualearn.core.execution.ExecutionResult;
import io.lingualearn.core.execution.StepOutcome;
import io.lingualearn.core.orchestrator.Orchestrator;
import io.lingualearn.core.orchestrator.Selection;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "run", description = "Run an agent or workflow, by name or by intent")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @ArgGroup(exclusive = true, multiplicity = "1")
    Target target;

    @Option(names = "--var", paramLabel = "KEY=VALUE", description = "Invocation input, repeatable")
    Map<String, String> variables = new LinkedHashMap<>();

    @Option(names = "--timeout", paramLabel = "SECONDS", description = "Per-step timeout override")
    Long timeoutSeconds;

    @Option(names = "--retry", description = "Re-run the whole invocation when a step fails (retry.maxRetries times)")
    boolean retry;

    static final class Target {
        @Option(names = "--name", required = true, description = "Exact agent or workflow name")
        String name;

        @Option(names = "--intent", required = true, description = "Free-text description of the task")
        String intent;
    }

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        CancellationSignal cancellation = new CancellationSignal();
        Thread interruptHook = new Thread(cancellation::cancel, "lingualearn-cancel");
        Runtime.getRuntime().addShutdownHook(interruptHook);
        try {
            LinguaLearnConfig config = context.loadValidated();
            try (Orchestrator orchestrator = context.openOrchestrator(config, event ->
                System.out.println("[" + event.stepIndex() + "] " + event.agentName() + ": " + event.state()
                    + (event.message() == null || event.message().isBlank() ? "" : " - " + event.message())))) {
                Catalog catalog = orchestrator.loadCatalog(context.configService().languages(config));
                Selection selection = target.name != null ? Selection.byName(target.name) : Selection.byIntent(target.intent);

                ExecutionOptions options = orchestrator.engine().defaultOptions();
                if (timeoutSeconds != null) {
                    options = options.withStepTimeout(Duration.ofSeconds(timeoutSeconds));
                }
                ExecutionResult result = retry
                    ? orchestrator.runWithRetry(catalog, selection, variables, config.retry().toPolicy(), cancellation, options)
                    : orchestrator.run(catalog, selection, variables, cancellation, options).join();
                print(result);
                return result.succeeded() ? 0 : 1;
            }
        } catch (Exception e) {
            System.err.println("Run failed: " + e.getMessage());
            return 1;
        } finally {
            removeHook(interruptHook);
        }
    }

    private static void print(ExecutionResult result) {
        System.out.println(result.name() + ": " + result.status() + " (invocation " + result.invocationId() + ")");
        for (StepOutcome step : result.steps()) {
            System.out.println("  " + step.index() + ". " + step.agentName() + " " + step.state()
                + (step.diagnostic().isBlank() ? "" : " - " + step.diagnostic()));
            for (Path artifact : step.artifacts()) {
                System.out.println("     -> " + artifact);
            }
        }
        result.failure().ifPresent(failure ->
            System.err.println("Failed at step " + failure.stepIndex() + " (" + failure.agentName() + "): " + failure.reason()));
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            System.err.println("Run interrupted: JVM is shutting down");
        }
    }
}
