package io.lingualearn.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionConfig(
    @JsonAlias({"step_timeout_seconds"}) int stepTimeoutSeconds,
    @JsonAlias({"output_root"}) String outputRoot,
    @JsonAlias({"max_parallel_steps"}) int maxParallelSteps,
    @JsonAlias({"max_concurrent_invocations"}) int maxConcurrentInvocations
) {

    public static ExecutionConfig defaults() {
        return new ExecutionConfig(600, "output", 1, 4);
    }
}
