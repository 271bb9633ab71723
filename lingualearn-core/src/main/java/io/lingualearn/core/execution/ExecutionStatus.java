package io.lingualearn.core.execution;

public enum ExecutionStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELLED
}
