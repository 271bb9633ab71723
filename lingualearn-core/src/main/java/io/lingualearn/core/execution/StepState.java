package io.lingualearn.core.execution;

/**
 * Per-step lifecycle: {@code PENDING -> RUNNING -> SUCCEEDED | FAILED | TIMED_OUT}, or
 * {@code PENDING -> NOT_RUN} when the workflow stops first.
 */
public enum StepState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    NOT_RUN;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }
}
