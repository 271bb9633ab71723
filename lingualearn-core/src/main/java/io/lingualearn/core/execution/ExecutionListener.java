package io.lingualearn.core.execution;

/**
 * Receives every step state transition. Called from engine worker threads.
 */
@FunctionalInterface
public interface ExecutionListener {
    ExecutionListener NOOP = event -> {
    };

    void onEvent(StepEvent event);
}
