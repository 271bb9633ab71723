package io.lingualearn.core.resilience;

import java.time.Duration;
import java.util.Objects;

public record RetryPolicy(int maxRetries, Duration initialDelay) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(1000);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO);
    }
}
