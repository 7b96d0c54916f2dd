package com.phillippitts.readaloud.service.buffer;

import com.phillippitts.readaloud.util.CancellationSignal;

import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Combined occupancy of the reorder buffer and the playback buffer, gating the synthesis workers.
 *
 * <p>An artifact is counted from its insertion into the reorder buffer until the controller
 * dequeues it from the playback buffer. Workers call {@link #awaitBelowHighWatermark()} before
 * pulling a new chunk.
 */
public final class BufferOccupancy {

    private final int highWatermark;
    private final CancellationSignal cancellation;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition belowHigh = lock.newCondition();
    private int count;

    public BufferOccupancy(int highWatermark, CancellationSignal cancellation) {
        if (highWatermark <= 0) {
            throw new IllegalArgumentException("highWatermark must be positive, got: " + highWatermark);
        }
        this.highWatermark = highWatermark;
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
        cancellation.onCancel(this::wakeAll);
    }

    void increment() {
        lock.lock();
        try {
            count++;
        } finally {
            lock.unlock();
        }
    }

    void decrement() {
        lock.lock();
        try {
            if (count > 0) {
                count--;
            }
            if (count < highWatermark) {
                belowHigh.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while the combined occupancy is at or above the high watermark.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws java.util.concurrent.CancellationException if the session is cancelled
     */
    public void awaitBelowHighWatermark() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (count >= highWatermark && !cancellation.isCancelled()) {
                belowHigh.await();
            }
            cancellation.throwIfCancelled();
        } finally {
            lock.unlock();
        }
    }

    public int get() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int highWatermark() {
        return highWatermark;
    }

    private void wakeAll() {
        lock.lock();
        try {
            belowHigh.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
