package com.phillippitts.readaloud.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single cooperative cancellation signal shared by every component of one session.
 *
 * <p>Blocking points either poll {@link #isCancelled()} or register a listener via
 * {@link #onCancel(Runnable)} that wakes them (signalling conditions, cancelling futures,
 * closing sources). Listeners run exactly once, on the thread that cancels.
 */
public final class CancellationSignal {

    private static final Logger LOG = LogManager.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Once> listeners = new CopyOnWriteArrayList<>();

    /**
     * Raises the signal and runs all registered listeners.
     *
     * @return {@code true} if this call raised the signal, {@code false} if it was already raised
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Once listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a listener. If the signal is already raised the listener runs immediately.
     *
     * @param listener action waking up a blocking point
     */
    public void onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        Once once = new Once(listener);
        listeners.add(once);
        if (cancelled.get()) {
            once.run();
        }
    }

    /**
     * @throws CancellationException if the signal has been raised
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Session cancelled");
        }
    }

    private static final class Once implements Runnable {
        private final Runnable delegate;
        private final AtomicBoolean ran = new AtomicBoolean();

        Once(Runnable delegate) {
            this.delegate = delegate;
        }

        @Override
        public void run() {
            if (!ran.compareAndSet(false, true)) {
                return;
            }
            try {
                delegate.run();
            } catch (RuntimeException e) {
                LOG.warn("Cancellation listener failed: {}", e.toString());
            }
        }
    }
}
