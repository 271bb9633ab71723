package io.lingualearn.core.execution;

/**
 * Why a workflow stopped: the 1-based step, its agent, the terminal state and a diagnostic.
 */
public record StepFailure(int stepIndex, String agentName, StepState state, String reason) {
}
