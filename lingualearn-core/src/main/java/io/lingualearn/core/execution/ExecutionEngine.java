package io.lingualearn.core.execution;

import io.lingualearn.core.catalog.AgentDescriptor;
import io.lingualearn.core.catalog.EntryKind;
import io.lingualearn.core.catalog.WorkflowDescriptor;
import io.lingualearn.core.concurrent.CancellationSignal;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs agents and workflows as external processes on a bounded worker pool.
 *
 * <p>Each call gets a fresh invocation id and output namespace. Steps fail fast: the first failed
 * or timed-out step stops the workflow and later steps are reported as not run. The engine never
 * retries; compose {@link ExecutionResult#orThrow()} with the retry executor for that.
 */
public final class ExecutionEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEngine.class);
    public static final int DEFAULT_MAX_CONCURRENT_INVOCATIONS = 4;

    private final ProcessFactory processFactory;
    private final ExecutionOptions defaultOptions;
    private final ExecutionListener listener;
    private final StepPlanner planner = new StepPlanner();
    private final ExecutorService invocationExecutor;
    private final ExecutorService stepExecutor;

    public ExecutionEngine(ExecutionOptions defaultOptions) {
        this(new DefaultProcessFactory(), defaultOptions, ExecutionListener.NOOP, DEFAULT_MAX_CONCURRENT_INVOCATIONS);
    }

    public ExecutionEngine(
        ProcessFactory processFactory,
        ExecutionOptions defaultOptions,
        ExecutionListener listener,
        int maxConcurrentInvocations
    ) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions must not be null");
        this.listener = listener == null ? ExecutionListener.NOOP : listener;
        if (maxConcurrentInvocations < 1) {
            throw new IllegalArgumentException("maxConcurrentInvocations must be at least 1");
        }
        this.invocationExecutor = Executors.newFixedThreadPool(maxConcurrentInvocations, daemonThreads("lingualearn-invocation"));
        this.stepExecutor = Executors.newCachedThreadPool(daemonThreads("lingualearn-step"));
    }

    public ExecutionOptions defaultOptions() {
        return defaultOptions;
    }

    public CompletableFuture<ExecutionResult> executeWorkflowAsync(
        WorkflowDescriptor workflow,
        Map<String, String> environment,
        CancellationSignal cancellation
    ) {
        return executeWorkflowAsync(workflow, environment, cancellation, defaultOptions);
    }

    public CompletableFuture<ExecutionResult> executeWorkflowAsync(
        WorkflowDescriptor workflow,
        Map<String, String> environment,
        CancellationSignal cancellation,
        ExecutionOptions options
    ) {
        return submit(workflow, EntryKind.WORKFLOW, environment, cancellation, options);
    }

    public CompletableFuture<ExecutionResult> executeAgentAsync(
        AgentDescriptor agent,
        Map<String, String> environment,
        CancellationSignal cancellation
    ) {
        return executeAgentAsync(agent, environment, cancellation, defaultOptions);
    }

    public CompletableFuture<ExecutionResult> executeAgentAsync(
        AgentDescriptor agent,
        Map<String, String> environment,
        CancellationSignal cancellation,
        ExecutionOptions options
    ) {
        Objects.requireNonNull(agent, "agent must not be null");
        return submit(WorkflowDescriptor.ofAgent(agent), EntryKind.AGENT, environment, cancellation, options);
    }

    private CompletableFuture<ExecutionResult> submit(
        WorkflowDescriptor workflow,
        EntryKind kind,
        Map<String, String> environment,
        CancellationSignal cancellation,
        ExecutionOptions options
    ) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        WorkflowInvocation invocation = new WorkflowInvocation(
            workflow,
            kind,
            UUID.randomUUID().toString(),
            environment,
            options == null ? defaultOptions : options,
            cancellation == null ? CancellationSignal.none() : cancellation,
            listener,
            processFactory,
            planner,
            stepExecutor
        );
        return CompletableFuture.supplyAsync(invocation::run, invocationExecutor)
            .whenComplete((result, error) -> {
                if (error != null) {
                    LOG.error("Invocation of '{}' failed unexpectedly", workflow.name(), error);
                }
            });
    }

    @Override
    public void close() {
        invocationExecutor.shutdown();
        stepExecutor.shutdown();
        try {
            if (!invocationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                invocationExecutor.shutdownNow();
            }
            if (!stepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                stepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            invocationExecutor.shutdownNow();
            stepExecutor.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
