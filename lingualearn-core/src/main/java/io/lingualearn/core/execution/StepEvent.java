package io.lingualearn.core.execution;

import java.time.Instant;

public record StepEvent(
    String invocationId,
    String workflowName,
    int stepIndex,
    String agentName,
    StepState state,
    Instant timestamp,
    String message
) {
}
