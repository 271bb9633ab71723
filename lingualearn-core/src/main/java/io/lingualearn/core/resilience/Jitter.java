package io.lingualearn.core.resilience;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random offset added to each backoff step.
 */
@FunctionalInterface
public interface Jitter {
    Duration next();

    /**
     * Uniform in {@code [minMillis, maxMillis)}.
     */
    static Jitter uniform(long minMillis, long maxMillis) {
        if (minMillis < 0 || maxMillis <= minMillis) {
            throw new IllegalArgumentException("invalid jitter range " + minMillis + ".." + maxMillis);
        }
        return () -> Duration.ofMillis(ThreadLocalRandom.current().nextLong(minMillis, maxMillis));
    }

    static Jitter none() {
        return () -> Duration.ZERO;
    }
}
