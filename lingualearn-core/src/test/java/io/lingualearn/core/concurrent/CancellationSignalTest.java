package io.lingualearn.core.concurrent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

    @Test
    void shouldNotifyListenersOnceOnCancel() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();
        signal.cancel();

        assertThat(signal.isCancelled()).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldRunLateListenerImmediately() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldSkipUnregisteredListener() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        Runnable unregister = signal.onCancel(calls::incrementAndGet);

        unregister.run();
        signal.cancel();

        assertThat(calls).hasValue(0);
    }

    @Test
    void shouldKeepNotifyingWhenAListenerFails() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();

        assertThat(calls).hasValue(1);
    }

    @Test
    void throwIfCancelledShouldRaiseCancellationException() {
        CancellationSignal signal = new CancellationSignal();
        signal.throwIfCancelled();
        signal.cancel();

        assertThatThrownBy(signal::throwIfCancelled).isInstanceOf(CancellationException.class);
    }
}
