package io.lingualearn.core.execution;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Result of one step. {@code exitCode} is {@code -1} when no process exited normally.
 */
public record StepOutcome(
    int index,
    String agentName,
    StepState state,
    int exitCode,
    String diagnostic,
    Duration duration,
    Path outputDirectory,
    List<Path> artifacts
) {
    public static final int NO_EXIT_CODE = -1;

    public StepOutcome {
        diagnostic = diagnostic == null ? "" : diagnostic;
        duration = duration == null ? Duration.ZERO : duration;
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    static StepOutcome pending(int index, String agentName, Path outputDirectory) {
        return new StepOutcome(index, agentName, StepState.PENDING, NO_EXIT_CODE, "", Duration.ZERO, outputDirectory, List.of());
    }

    StepOutcome notRun(String reason) {
        return new StepOutcome(index, agentName, StepState.NOT_RUN, NO_EXIT_CODE, reason, Duration.ZERO, outputDirectory, List.of());
    }
}
