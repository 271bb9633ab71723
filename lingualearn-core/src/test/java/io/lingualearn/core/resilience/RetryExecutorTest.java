package io.lingualearn.core.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lingualearn.core.concurrent.CancellationSignal;
import io.lingualearn.core.error.EmbeddingProviderException;
import io.lingualearn.core.error.LinguaLearnException;
import io.lingualearn.core.error.RetryExhaustedException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final RetryExecutor executor = new RetryExecutor(new RetryClassifier(), sleeper, Jitter.none());
    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100));

    @Test
    void shouldSucceedAfterTransientFailuresWithGrowingDelays() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.executeWithRetry(() -> {
            if (attempts.incrementAndGet() <= 2) {
                throw new EmbeddingProviderException("server busy", 503, null, null);
            }
            return "ok";
        }, policy);

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
        assertThat(sleeper.waits).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void shouldGiveUpAfterMaxRetriesPlusOneAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.executeWithRetry(() -> {
            attempts.incrementAndGet();
            throw new EmbeddingProviderException("rate limited", 429, null, null);
        }, policy))
            .isInstanceOfSatisfying(RetryExhaustedException.class, exhausted -> {
                assertThat(exhausted.attempts()).isEqualTo(4);
                assertThat(exhausted.lastError()).hasMessage("rate limited");
            });
        assertThat(attempts).hasValue(4);
        assertThat(sleeper.waits)
            .containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
    }

    @Test
    void shouldNotRetryNonRetryableErrors() {
        AtomicInteger attempts = new AtomicInteger();
        EmbeddingProviderException unauthorized = new EmbeddingProviderException("bad key", 401, null, null);

        assertThatThrownBy(() -> executor.executeWithRetry(() -> {
            attempts.incrementAndGet();
            throw unauthorized;
        }, policy, error -> true, CancellationSignal.none()))
            .isSameAs(unauthorized);
        assertThat(attempts).hasValue(1);
        assertThat(sleeper.waits).isEmpty();
    }

    @Test
    void shouldNotRetryUnclassifiedErrorsWithoutPredicate() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.executeWithRetry(() -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("broken");
        }, policy))
            .isInstanceOf(IllegalStateException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void shouldRetryWhatThePredicateAccepts() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.executeWithRetry(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("flaky");
            }
            return "second time";
        }, policy, error -> error instanceof IllegalStateException, CancellationSignal.none());

        assertThat(result).isEqualTo("second time");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void shouldHonourRetryAfterHintForNextWaitOnly() {
        AtomicInteger attempts = new AtomicInteger();

        executor.executeWithRetry(() -> {
            int attempt = attempts.incrementAndGet();
            if (attempt == 1) {
                throw new EmbeddingProviderException("slow down", 429, Duration.ofSeconds(7), null);
            }
            if (attempt == 2) {
                throw new EmbeddingProviderException("still busy", 503, null, null);
            }
            return "done";
        }, policy);

        assertThat(sleeper.waits).containsExactly(Duration.ofSeconds(7), Duration.ofMillis(200));
    }

    @Test
    void shouldFallBackToComputedDelayWhenRetryAfterHintIsTooLong() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.executeWithRetry(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("HTTP 429: retry after 99999999999999999999 seconds");
            }
            return "done";
        }, policy);

        assertThat(result).isEqualTo("done");
        assertThat(attempts).hasValue(2);
        assertThat(sleeper.waits).containsExactly(Duration.ofMillis(100));
    }

    @Test
    void shouldWrapCheckedNonRetryableErrors() {
        assertThatThrownBy(() -> executor.executeWithRetry(() -> {
            throw new IOException("disk gone");
        }, policy))
            .isInstanceOf(LinguaLearnException.class)
            .hasMessage("disk gone")
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void shouldStopWhenCancelledBetweenAttempts() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger attempts = new AtomicInteger();
        RetryExecutor cancelling = new RetryExecutor(new RetryClassifier(), (delay, cancellation) -> {
            signal.cancel();
            cancellation.throwIfCancelled();
        }, Jitter.none());

        assertThatThrownBy(() -> cancelling.executeWithRetry(() -> {
            attempts.incrementAndGet();
            throw new EmbeddingProviderException("timeout", 504, null, null);
        }, policy, null, signal))
            .isInstanceOf(CancellationException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void shouldNotStartWhenAlreadyCancelled() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.executeWithRetry(() -> attempts.incrementAndGet(), policy, null, signal))
            .isInstanceOf(CancellationException.class);
        assertThat(attempts).hasValue(0);
    }

    @Test
    void systemSleeperShouldWakeUpOnCancel() {
        CancellationSignal signal = new CancellationSignal();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel();
        });
        canceller.start();
        long started = System.nanoTime();

        assertThatThrownBy(() -> Sleeper.system().sleep(Duration.ofSeconds(30), signal))
            .isInstanceOf(CancellationException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    private static final class RecordingSleeper implements Sleeper {
        private final List<Duration> waits = new ArrayList<>();

        @Override
        public void sleep(Duration delay, CancellationSignal cancellation) {
            cancellation.throwIfCancelled();
            waits.add(delay);
        }
    }
}
