package io.lingualearn.core.execution;

import io.lingualearn.core.catalog.AgentDescriptor;
import io.lingualearn.core.catalog.EntryKind;
import io.lingualearn.core.catalog.Placeholders;
import io.lingualearn.core.catalog.WorkflowDescriptor;
import io.lingualearn.core.concurrent.CancellationSignal;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one engine invocation. Owns its output directory and its step outcomes; nothing here is
 * shared with other invocations.
 */
final class WorkflowInvocation {
    private static final Logger LOG = LoggerFactory.getLogger(WorkflowInvocation.class);
    static final String OUTPUT_DIR_ENV = "LINGUALEARN_OUTPUT_DIR";
    static final String INVOCATION_ID_ENV = "LINGUALEARN_INVOCATION_ID";
    static final String STEP_INDEX_ENV = "LINGUALEARN_STEP_INDEX";
    static final String WORKFLOW_ENV = "LINGUALEARN_WORKFLOW";
    private static final int STDOUT_MAX_BYTES = 64 * 1024;
    private static final int STDERR_MAX_BYTES = 16 * 1024;
    private static final int DIAGNOSTIC_MAX_CHARS = 2000;
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);

    private final WorkflowDescriptor workflow;
    private final EntryKind kind;
    private final String invocationId;
    private final Path invocationDirectory;
    private final Map<String, String> invocationEnvironment;
    private final ExecutionOptions options;
    private final CancellationSignal cancellation;
    private final CancellationSignal abort = new CancellationSignal();
    private final ExecutionListener listener;
    private final ProcessFactory processFactory;
    private final StepPlanner planner;
    private final Executor stepExecutor;
    private final AtomicReferenceArray<StepOutcome> outcomes;
    private final AtomicReference<StepFailure> firstFailure = new AtomicReference<>();

    WorkflowInvocation(
        WorkflowDescriptor workflow,
        EntryKind kind,
        String invocationId,
        Map<String, String> invocationEnvironment,
        ExecutionOptions options,
        CancellationSignal cancellation,
        ExecutionListener listener,
        ProcessFactory processFactory,
        StepPlanner planner,
        Executor stepExecutor
    ) {
        this.workflow = workflow;
        this.kind = kind;
        this.invocationId = invocationId;
        this.invocationDirectory = OutputNamespace.invocationDirectory(options.outputRoot(), workflow.name(), invocationId);
        this.invocationEnvironment = invocationEnvironment == null ? Map.of() : Map.copyOf(invocationEnvironment);
        this.options = options;
        this.cancellation = cancellation;
        this.listener = listener;
        this.processFactory = processFactory;
        this.planner = planner;
        this.stepExecutor = stepExecutor;
        this.outcomes = new AtomicReferenceArray<>(workflow.steps().size());
        for (int i = 0; i < workflow.steps().size(); i++) {
            AgentDescriptor agent = workflow.steps().get(i);
            outcomes.set(i, StepOutcome.pending(i + 1, agent.name(), stepDirectory(i)));
        }
    }

    ExecutionResult run() {
        LOG.info(
            "Starting {} '{}' with {} step(s), invocation {}",
            kind == EntryKind.AGENT ? "agent" : "workflow",
            workflow.name(),
            workflow.steps().size(),
            invocationId
        );
        for (List<Integer> batch : planner.plan(workflow, options.maxParallelSteps())) {
            if (stopped()) {
                break;
            }
            if (batch.size() == 1 || options.maxParallelSteps() == 1) {
                for (int index : batch) {
                    if (stopped()) {
                        break;
                    }
                    runStep(index);
                }
            } else {
                runConcurrently(batch);
            }
        }
        return finish();
    }

    private void runConcurrently(List<Integer> batch) {
        for (int from = 0; from < batch.size() && !stopped(); from += options.maxParallelSteps()) {
            List<Integer> chunk = batch.subList(from, Math.min(batch.size(), from + options.maxParallelSteps()));
            CompletableFuture<?>[] running = chunk.stream()
                .map(index -> CompletableFuture.runAsync(() -> runStep(index), stepExecutor))
                .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(running).join();
        }
    }

    private boolean stopped() {
        return cancellation.isCancelled() || firstFailure.get() != null;
    }

    private void runStep(int index) {
        if (stopped()) {
            return;
        }
        AgentDescriptor agent = workflow.steps().get(index);
        int number = index + 1;
        Path stepDirectory = stepDirectory(index);
        publish(number, agent.name(), StepState.RUNNING, "started");
        LOG.info("Running step {}/{} ({}) of '{}'", number, workflow.steps().size(), agent.name(), workflow.name());

        Instant started = Instant.now();
        StepOutcome outcome;
        try {
            Files.createDirectories(stepDirectory);
            Map<String, String> values = resolvePlaceholders(agent, index, stepDirectory);
            List<String> command = command(agent, values);
            Map<String, String> environment = environment(agent, number, stepDirectory, values);
            if (!Files.isDirectory(agent.workingDirectory())) {
                throw new StepSetupException("working directory not found: " + agent.workingDirectory());
            }
            Process process = processFactory.start(command, agent.workingDirectory(), environment);
            outcome = await(process, number, agent, stepDirectory, started);
        } catch (StepSetupException e) {
            outcome = failed(number, agent, stepDirectory, started, e.getMessage());
        } catch (IOException e) {
            outcome = failed(number, agent, stepDirectory, started, "failed to start process: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Step {} ({}) of '{}' could not be started", number, agent.name(), workflow.name(), e);
            outcome = failed(number, agent, stepDirectory, started, "failed to start process: " + e);
        }

        outcomes.set(index, outcome);
        if (outcome.state().isFailure()) {
            StepFailure failure = new StepFailure(number, agent.name(), outcome.state(), outcome.diagnostic());
            if (firstFailure.compareAndSet(null, failure)) {
                LOG.warn("Step {} ({}) of '{}' {}: {}", number, agent.name(), workflow.name(), outcome.state(), outcome.diagnostic());
                abort.cancel();
            }
        } else {
            LOG.info("Step {} ({}) succeeded in {} ms with {} artifact(s)",
                number, agent.name(), outcome.duration().toMillis(), outcome.artifacts().size());
        }
        publish(number, agent.name(), outcome.state(), outcome.diagnostic());
    }

    private StepOutcome await(Process process, int number, AgentDescriptor agent, Path stepDirectory, Instant started) {
        String threadPrefix = "lingualearn-" + invocationId.substring(0, Math.min(8, invocationId.length())) + "-" + number;
        StreamCollector stdout = StreamCollector.start(process.getInputStream(), threadPrefix + "-out", STDOUT_MAX_BYTES);
        StreamCollector stderr = StreamCollector.start(process.getErrorStream(), threadPrefix + "-err", STDERR_MAX_BYTES);
        AtomicReference<String> stopReason = new AtomicReference<>();
        Runnable unregisterCancel = cancellation.onCancel(() -> {
            stopReason.compareAndSet(null, "cancelled");
            process.destroyForcibly();
        });
        Runnable unregisterAbort = abort.onCancel(() -> {
            stopReason.compareAndSet(null, "terminated after another step failed");
            process.destroyForcibly();
        });

        try {
            boolean finished = process.waitFor(options.stepTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
                return outcome(number, agent, StepState.TIMED_OUT, StepOutcome.NO_EXIT_CODE,
                    "timed out after " + options.stepTimeout().toSeconds() + "s", stepDirectory, started);
            }
            if (stopReason.get() != null) {
                return outcome(number, agent, StepState.FAILED, StepOutcome.NO_EXIT_CODE, stopReason.get(), stepDirectory, started);
            }
            int exitCode = process.exitValue();
            joinCollectors(stdout, stderr);
            LOG.debug("Step {} ({}) stdout: {}", number, agent.name(), tail(stdout.text()));
            if (exitCode == 0) {
                return outcome(number, agent, StepState.SUCCEEDED, exitCode, "", stepDirectory, started);
            }
            String output = stderr.text().isBlank() ? stdout.text() : stderr.text();
            String diagnostic = "exit code " + exitCode + (output.isBlank() ? "" : ": " + tail(output));
            return outcome(number, agent, StepState.FAILED, exitCode, diagnostic, stepDirectory, started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return outcome(number, agent, StepState.FAILED, StepOutcome.NO_EXIT_CODE, "interrupted", stepDirectory, started);
        } finally {
            unregisterCancel.run();
            unregisterAbort.run();
            joinCollectors(stdout, stderr);
        }
    }

    private StepOutcome outcome(
        int number,
        AgentDescriptor agent,
        StepState state,
        int exitCode,
        String diagnostic,
        Path stepDirectory,
        Instant started
    ) {
        List<Path> artifacts;
        try {
            artifacts = listArtifacts(stepDirectory);
        } catch (IOException e) {
            if (state == StepState.SUCCEEDED) {
                return failed(number, agent, stepDirectory, started, "failed to list artifacts: " + e.getMessage());
            }
            LOG.warn("Failed to list artifacts of step {} ({}): {}", number, agent.name(), e.getMessage());
            artifacts = List.of();
        }
        Duration duration = Duration.between(started, Instant.now());
        return new StepOutcome(number, agent.name(), state, exitCode, diagnostic, duration, stepDirectory, artifacts);
    }

    private StepOutcome failed(int number, AgentDescriptor agent, Path stepDirectory, Instant started, String diagnostic) {
        Duration duration = Duration.between(started, Instant.now());
        return new StepOutcome(number, agent.name(), StepState.FAILED, StepOutcome.NO_EXIT_CODE, diagnostic, duration, stepDirectory, List.of());
    }

    private Map<String, String> resolvePlaceholders(AgentDescriptor agent, int index, Path stepDirectory) throws StepSetupException {
        Map<String, String> builtIns = Map.of(
            "outputDir", stepDirectory.toString(),
            "invocationId", invocationId,
            "stepIndex", String.valueOf(index + 1)
        );
        Map<String, String> values = new LinkedHashMap<>();
        for (String placeholder : agent.placeholders()) {
            int producer = workflow.producerOf(placeholder);
            if (producer >= 0) {
                values.put(placeholder, artifactFor(placeholder, producer).toString());
            } else if (invocationEnvironment.containsKey(placeholder)) {
                values.put(placeholder, invocationEnvironment.get(placeholder));
            } else if (invocationEnvironment.containsKey(Placeholders.toEnvironmentKey(placeholder))) {
                values.put(placeholder, invocationEnvironment.get(Placeholders.toEnvironmentKey(placeholder)));
            } else if (builtIns.containsKey(placeholder)) {
                values.put(placeholder, builtIns.get(placeholder));
            } else {
                throw new StepSetupException("unresolved placeholder '{{" + placeholder
                    + "}}': no step produces it and the caller did not supply it");
            }
        }
        return values;
    }

    private Path artifactFor(String placeholder, int producer) throws StepSetupException {
        StepOutcome produced = outcomes.get(producer);
        if (produced.state() != StepState.SUCCEEDED) {
            throw new StepSetupException("unresolved placeholder '{{" + placeholder + "}}': step "
                + produced.index() + " (" + produced.agentName() + ") did not succeed");
        }
        for (Path artifact : produced.artifacts()) {
            String fileName = artifact.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
            if (stem.equals(placeholder)) {
                return artifact;
            }
        }
        if (produced.artifacts().size() == 1) {
            return produced.artifacts().get(0);
        }
        throw new StepSetupException("unresolved placeholder '{{" + placeholder + "}}': step " + produced.index()
            + " (" + produced.agentName() + ") produced " + produced.artifacts().size()
            + " artifact(s) and none is named '" + placeholder + "'");
    }

    private List<String> command(AgentDescriptor agent, Map<String, String> values) {
        List<String> command = new ArrayList<>();
        String executable = agent.executablePath();
        Path executablePath = Path.of(executable);
        if (!executablePath.isAbsolute() && executablePath.getNameCount() > 1) {
            executable = agent.workingDirectory().resolve(executablePath).normalize().toString();
        }
        command.add(executable);
        for (String argument : agent.arguments()) {
            command.add(Placeholders.substitute(argument, values));
        }
        return command;
    }

    private Map<String, String> environment(AgentDescriptor agent, int number, Path stepDirectory, Map<String, String> values) {
        Map<String, String> environment = new LinkedHashMap<>();
        agent.environmentVariables().forEach((key, value) -> environment.put(key, Placeholders.substitute(value, values)));
        environment.putAll(invocationEnvironment);
        values.forEach((placeholder, value) -> environment.put(Placeholders.toEnvironmentKey(placeholder), value));
        environment.put(OUTPUT_DIR_ENV, stepDirectory.toString());
        environment.put(INVOCATION_ID_ENV, invocationId);
        environment.put(STEP_INDEX_ENV, String.valueOf(number));
        environment.put(WORKFLOW_ENV, workflow.name());
        return environment;
    }

    private ExecutionResult finish() {
        boolean cancelled = cancellation.isCancelled();
        StepFailure failure = firstFailure.get();
        String reason = failure != null
            ? "step " + failure.stepIndex() + " (" + failure.agentName() + ") " + failure.state().name().toLowerCase(Locale.ROOT)
            : "cancelled";

        List<StepOutcome> steps = new ArrayList<>();
        for (int i = 0; i < outcomes.length(); i++) {
            StepOutcome outcome = outcomes.get(i);
            if (outcome.state() == StepState.PENDING) {
                outcome = outcome.notRun("not run: " + reason);
                outcomes.set(i, outcome);
                publish(outcome.index(), outcome.agentName(), StepState.NOT_RUN, outcome.diagnostic());
            }
            steps.add(outcome);
        }

        ExecutionStatus status;
        if (cancelled && (failure != null || steps.stream().anyMatch(step -> step.state() != StepState.SUCCEEDED))) {
            status = ExecutionStatus.CANCELLED;
        } else if (failure != null) {
            status = failure.state() == StepState.TIMED_OUT ? ExecutionStatus.TIMED_OUT : ExecutionStatus.FAILED;
        } else {
            status = ExecutionStatus.SUCCEEDED;
        }
        LOG.info("Finished '{}' invocation {} with status {}", workflow.name(), invocationId, status);
        return new ExecutionResult(workflow.name(), kind, invocationId, invocationDirectory, status, steps, failure);
    }

    private Path stepDirectory(int index) {
        return OutputNamespace.stepDirectory(invocationDirectory, index + 1, workflow.steps().get(index).name());
    }

    private void publish(int number, String agentName, StepState state, String message) {
        try {
            listener.onEvent(new StepEvent(invocationId, workflow.name(), number, agentName, state, Instant.now(), message));
        } catch (RuntimeException e) {
            LOG.warn("Execution listener failed on {} event: {}", state, e.toString());
        }
    }

    private static List<Path> listArtifacts(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        }
    }

    private static void joinCollectors(StreamCollector stdout, StreamCollector stderr) {
        stdout.join(Duration.ofSeconds(2));
        stderr.join(Duration.ofSeconds(2));
    }

    private static String tail(String text) {
        String trimmed = text.strip();
        if (trimmed.length() <= DIAGNOSTIC_MAX_CHARS) {
            return trimmed;
        }
        return "..." + trimmed.substring(trimmed.length() - DIAGNOSTIC_MAX_CHARS);
    }

    private static final class StepSetupException extends Exception {
        StepSetupException(String message) {
            super(message);
        }
    }
}
