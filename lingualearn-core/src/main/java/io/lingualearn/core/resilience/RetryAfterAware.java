package io.lingualearn.core.resilience;

import java.time.Duration;
import java.util.Optional;

/**
 * Implemented by errors that carry a server-supplied wait hint.
 */
public interface RetryAfterAware {
    Optional<Duration> retryAfter();
}
