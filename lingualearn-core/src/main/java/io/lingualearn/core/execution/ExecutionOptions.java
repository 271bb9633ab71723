package io.lingualearn.core.execution;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * @param stepTimeout wall-clock limit for each step's process
 * @param outputRoot directory under which every invocation gets its own namespace
 * @param maxParallelSteps {@code 1} runs steps strictly in declared order; higher values let
 *     independent steps of the same dependency level run together
 */
public record ExecutionOptions(Duration stepTimeout, Path outputRoot, int maxParallelSteps) {
    public static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofMinutes(10);

    public ExecutionOptions {
        Objects.requireNonNull(stepTimeout, "stepTimeout must not be null");
        Objects.requireNonNull(outputRoot, "outputRoot must not be null");
        if (stepTimeout.isZero() || stepTimeout.isNegative()) {
            throw new IllegalArgumentException("stepTimeout must be positive");
        }
        if (maxParallelSteps < 1) {
            throw new IllegalArgumentException("maxParallelSteps must be at least 1");
        }
    }

    public static ExecutionOptions defaults(Path outputRoot) {
        return new ExecutionOptions(DEFAULT_STEP_TIMEOUT, outputRoot, 1);
    }

    public ExecutionOptions withStepTimeout(Duration timeout) {
        return new ExecutionOptions(timeout, outputRoot, maxParallelSteps);
    }
}
