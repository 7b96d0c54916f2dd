package com.phillippitts.readaloud.service.buffer;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.util.CancellationSignal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of in-order artifacts waiting to be played.
 *
 * <p>Producer: the {@link ReorderBuffer} release path. Consumer: the playback controller.
 * {@link #accept(AudioArtifact)} blocks at {@code capacity}; {@link #dequeue()} blocks while empty
 * until an artifact arrives, the buffer is closed, or the session is cancelled.
 *
 * <p>The low watermark is the occupancy the controller waits for before (re)starting playback;
 * the high watermark lives in the shared {@link BufferOccupancy} that throttles the workers.
 */
public final class PlaybackBuffer implements ArtifactSink {

    private final int capacity;
    private final int lowWatermark;
    private final BufferOccupancy occupancy;
    private final CancellationSignal cancellation;
    private final ArrayDeque<AudioArtifact> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    public PlaybackBuffer(int capacity, int lowWatermark, BufferOccupancy occupancy,
                          CancellationSignal cancellation) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        if (lowWatermark <= 0 || lowWatermark > capacity) {
            throw new IllegalArgumentException(
                    "lowWatermark must be in [1, capacity], got: " + lowWatermark);
        }
        this.capacity = capacity;
        this.lowWatermark = lowWatermark;
        this.occupancy = Objects.requireNonNull(occupancy, "occupancy must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
        cancellation.onCancel(this::wakeAll);
    }

    /**
     * Enqueues an artifact, blocking while the buffer is at capacity.
     */
    @Override
    public void accept(AudioArtifact artifact) throws InterruptedException {
        Objects.requireNonNull(artifact, "artifact must not be null");
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !cancellation.isCancelled()) {
                notFull.await();
            }
            cancellation.throwIfCancelled();
            if (closed) {
                throw new IllegalStateException("Playback buffer is closed");
            }
            items.addLast(artifact);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next artifact, waiting while the buffer is empty and still open.
     *
     * @return next artifact, or empty once the buffer is closed and drained
     * @throws InterruptedException if interrupted while waiting
     * @throws CancellationException if the session is cancelled
     */
    public Optional<AudioArtifact> dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed && !cancellation.isCancelled()) {
                notEmpty.await();
            }
            cancellation.throwIfCancelled();
            return Optional.ofNullable(removeHead());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next artifact without waiting.
     *
     * @return next artifact, or empty if none is buffered right now
     */
    public Optional<AudioArtifact> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(removeHead());
        } finally {
            lock.unlock();
        }
    }

    private AudioArtifact removeHead() {
        AudioArtifact head = items.pollFirst();
        if (head != null) {
            notFull.signal();
            occupancy.decrement();
        }
        return head;
    }

    /**
     * Waits until the buffer holds at least the low watermark, or no more artifacts can arrive.
     *
     * @return {@code true} if an artifact is available afterwards
     * @throws InterruptedException if interrupted while waiting
     * @throws CancellationException if the session is cancelled
     */
    public boolean awaitLowWatermark() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.size() < lowWatermark && !closed && !cancellation.isCancelled()) {
                notEmpty.await();
            }
            cancellation.throwIfCancelled();
            return !items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the end of the artifact stream. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every buffered artifact; used on stop so the caller can release their audio.
     *
     * @return the artifacts that were still buffered
     */
    public List<AudioArtifact> drainAll() {
        lock.lock();
        try {
            List<AudioArtifact> drained = new ArrayList<>(items.size());
            AudioArtifact next;
            while ((next = removeHead()) != null) {
                drained.add(next);
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int capacity() {
        return capacity;
    }

    public int lowWatermark() {
        return lowWatermark;
    }

    public int highWatermark() {
        return occupancy.highWatermark();
    }

    private void wakeAll() {
        lock.lock();
        try {
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
