package io.lingualearn.core.resilience;

import io.lingualearn.core.concurrent.CancellationSignal;
import io.lingualearn.core.error.LinguaLearnException;
import io.lingualearn.core.error.RetryExhaustedException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation with exponential backoff.
 *
 * <p>A failure is retried when it is not non-retryable and either the caller's predicate
 * accepts it or, without a predicate, the {@link RetryClassifier} deems it transient. The delay
 * starts at {@link RetryPolicy#initialDelay()} and grows as {@code delay * 2 + jitter}; a
 * retry-after hint replaces the delay for the next wait only. The operation runs at most
 * {@code maxRetries + 1} times.
 */
public final class RetryExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryClassifier classifier;
    private final Sleeper sleeper;
    private final Jitter jitter;

    public RetryExecutor() {
        this(new RetryClassifier(), Sleeper.system(), Jitter.uniform(100, 500));
    }

    public RetryExecutor(RetryClassifier classifier, Sleeper sleeper, Jitter jitter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
    }

    public <T> T executeWithRetry(RetryableOperation<T> operation, RetryPolicy policy) {
        return executeWithRetry(operation, policy, null, CancellationSignal.none());
    }

    public <T> T executeWithRetry(
        RetryableOperation<T> operation,
        RetryPolicy policy,
        Predicate<Throwable> retryPredicate,
        CancellationSignal cancellation
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;

        int retries = 0;
        Duration delay = policy.initialDelay();
        while (true) {
            signal.throwIfCancelled();
            try {
                return operation.call();
            } catch (Exception e) {
                if (!shouldRetry(e, retryPredicate)) {
                    throw propagate(e);
                }
                if (retries >= policy.maxRetries()) {
                    LOG.warn("Maximum retries ({}) exceeded: {}", policy.maxRetries(), e.toString());
                    throw new RetryExhaustedException(retries + 1, e);
                }
                retries++;
                Optional<Duration> hint = classifier.retryAfter(e);
                Duration wait = hint.orElse(delay);
                LOG.warn(
                    "Retrying in {} ms after error: {} (attempt {} of {})",
                    wait.toMillis(),
                    e.getMessage(),
                    retries,
                    policy.maxRetries()
                );
                sleeper.sleep(wait, signal);
                delay = delay.multipliedBy(2).plus(jitter.next());
            }
        }
    }

    private boolean shouldRetry(Exception error, Predicate<Throwable> retryPredicate) {
        if (classifier.isNonRetryable(error)) {
            return false;
        }
        if (retryPredicate != null) {
            return retryPredicate.test(error);
        }
        return classifier.isTransient(error);
    }

    private RuntimeException propagate(Exception error) {
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        return new LinguaLearnException(error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage(), error);
    }
}
