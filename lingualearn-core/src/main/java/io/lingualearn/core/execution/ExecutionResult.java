package io.lingualearn.core.execution;

import io.lingualearn.core.catalog.EntryKind;
import io.lingualearn.core.error.WorkflowAbortedException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Outcome of one invocation of an agent or workflow.
 */
public record ExecutionResult(
    String name,
    EntryKind kind,
    String invocationId,
    Path outputDirectory,
    ExecutionStatus status,
    List<StepOutcome> steps,
    StepFailure primaryFailure
) {

    public ExecutionResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public boolean succeeded() {
        return status == ExecutionStatus.SUCCEEDED;
    }

    public Optional<StepFailure> failure() {
        return Optional.ofNullable(primaryFailure);
    }

    /**
     * 1-based index of the step that stopped the workflow.
     */
    public OptionalInt failedStep() {
        return primaryFailure == null ? OptionalInt.empty() : OptionalInt.of(primaryFailure.stepIndex());
    }

    /**
     * Artifacts of every step, in step order.
     */
    public List<Path> artifacts() {
        return steps.stream().flatMap(step -> step.artifacts().stream()).toList();
    }

    public ExecutionResult orThrow() {
        if (!succeeded()) {
            throw new WorkflowAbortedException(this);
        }
        return this;
    }
}
