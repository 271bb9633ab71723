package io.lingualearn.core.error;

import io.lingualearn.core.resilience.RetryAfterAware;
import java.time.Duration;
import java.util.Optional;

/**
 * Raised when the embedding provider is unreachable, answers with an error status,
 * or returns an empty vector.
 */
public class EmbeddingProviderException extends LinguaLearnException implements RetryAfterAware {

    private final int statusCode;
    private final Duration retryAfter;

    public EmbeddingProviderException(String message) {
        this(message, -1, null, null);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        this(message, -1, null, cause);
    }

    public EmbeddingProviderException(String message, int statusCode, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    /**
     * HTTP status reported by the provider, or {@code -1} when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }

    @Override
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
