package io.lingualearn.core.concurrent;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation shared between a caller and the work it started. Listeners run
 * once, on the thread that calls {@link #cancel()}, or immediately when registered late.
 */
public final class CancellationSignal {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            notifyListener(listener);
        }
        listeners.clear();
    }

    /**
     * Registers a callback and returns a handle that unregisters it.
     */
    public Runnable onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            notifyListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("cancelled");
        }
    }

    private void notifyListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation listener failed: {}", e.toString());
        }
    }
}
