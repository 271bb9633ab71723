package io.lingualearn.core.error;

import io.lingualearn.core.execution.ExecutionResult;
import io.lingualearn.core.execution.StepFailure;

/**
 * Fail-fast propagation of a {@link StepFailure}: the workflow stopped at the failing step.
 * Raised by {@link ExecutionResult#orThrow()} so that whole-invocation retry can be composed
 * with the retry executor.
 */
public class WorkflowAbortedException extends LinguaLearnException {

    private final transient ExecutionResult result;

    public WorkflowAbortedException(ExecutionResult result) {
        super(message(result));
        this.result = result;
    }

    public ExecutionResult result() {
        return result;
    }

    public StepFailure failure() {
        return result.failure().orElse(null);
    }

    private static String message(ExecutionResult result) {
        return result.failure()
            .map(failure -> "Workflow '" + result.name() + "' aborted at step " + failure.stepIndex()
                + " (" + failure.agentName() + "): " + failure.reason())
            .orElse("Workflow '" + result.name() + "' aborted: " + result.status());
    }
}
