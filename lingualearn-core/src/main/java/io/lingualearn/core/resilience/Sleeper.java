package io.lingualearn.core.resilience;

import io.lingualearn.core.concurrent.CancellationSignal;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Waits between retry attempts. Implementations must return early with a
 * {@link CancellationException} once the signal is cancelled.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration delay, CancellationSignal cancellation);

    static Sleeper system() {
        return (delay, cancellation) -> {
            cancellation.throwIfCancelled();
            if (delay.isZero() || delay.isNegative()) {
                return;
            }
            CountDownLatch wakeUp = new CountDownLatch(1);
            Runnable unregister = cancellation.onCancel(wakeUp::countDown);
            try {
                wakeUp.await(delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException("interrupted while waiting to retry");
                cancelled.initCause(e);
                throw cancelled;
            } finally {
                unregister.run();
            }
            cancellation.throwIfCancelled();
        };
    }
}
