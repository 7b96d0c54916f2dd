package com.phillippitts.readaloud.service.buffer;

import com.phillippitts.readaloud.domain.TextChunk;
import com.phillippitts.readaloud.util.CancellationSignal;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of chunks between the feeder (single producer) and the synthesis workers.
 *
 * <p>The feeder {@link #close() closes} the queue when the source is exhausted; workers then
 * drain the remaining chunks and receive {@link Optional#empty()}.
 */
public final class WorkQueue implements ChunkSink {

    private final int capacity;
    private final CancellationSignal cancellation;
    private final ArrayDeque<TextChunk> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    public WorkQueue(int capacity, CancellationSignal cancellation) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
        cancellation.onCancel(this::wakeAll);
    }

    @Override
    public void accept(TextChunk chunk) throws InterruptedException {
        Objects.requireNonNull(chunk, "chunk must not be null");
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !cancellation.isCancelled()) {
                notFull.await();
            }
            cancellation.throwIfCancelled();
            if (closed) {
                throw new IllegalStateException("Work queue is closed");
            }
            items.addLast(chunk);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next chunk, waiting while the queue is empty and still open.
     *
     * @return next chunk, or empty once the queue is closed and drained
     * @throws InterruptedException if interrupted while waiting
     * @throws CancellationException if the session is cancelled
     */
    public Optional<TextChunk> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed && !cancellation.isCancelled()) {
                notEmpty.await();
            }
            cancellation.throwIfCancelled();
            TextChunk next = items.pollFirst();
            if (next != null) {
                notFull.signal();
            }
            return Optional.ofNullable(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the end of the chunk stream. Idempotent.
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

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
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
