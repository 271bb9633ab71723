package io.lingualearn.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.lingualearn.core.resilience.RetryPolicy;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetryConfig(
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"initial_delay_ms"}) long initialDelayMs
) {

    public static RetryConfig defaults() {
        return new RetryConfig(RetryPolicy.DEFAULT_MAX_RETRIES, RetryPolicy.DEFAULT_INITIAL_DELAY.toMillis());
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(maxRetries, Duration.ofMillis(initialDelayMs));
    }
}
