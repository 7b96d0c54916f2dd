package com.phillippitts.readaloud.service.progress;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.domain.PlaybackState;
import com.phillippitts.readaloud.domain.ProgressSnapshot;
import com.phillippitts.readaloud.domain.TextChunk;
import com.phillippitts.readaloud.service.progress.event.ChunkFailedEvent;
import com.phillippitts.readaloud.service.progress.event.PlaybackStateChangedEvent;
import com.phillippitts.readaloud.service.progress.event.ProgressUpdatedEvent;
import com.phillippitts.readaloud.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Aggregates the counters of one session and publishes progress to its {@link ProgressListener}.
 *
 * <p>Feeder, workers, controller and state machine report events as they happen; nothing is
 * polled except the live playback buffer size. Snapshots are published by a scheduled task at
 * most once per publish interval and only when something changed. Chunk failures and state
 * changes are forwarded immediately. The terminal transition publishes one final snapshot.
 *
 * <p>Counters only grow, so published {@code chunksPlayed} values never decrease.
 */
public final class ProgressTracker implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ProgressTracker.class);

    private final String sessionId;
    private final ProgressListener listener;
    private final IntSupplier bufferedCount;
    private final long startNanos = System.nanoTime();

    private final AtomicInteger fetched = new AtomicInteger();
    private final AtomicInteger synthesized = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger played = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger retries = new AtomicInteger();
    private final AtomicInteger totalEstimate = new AtomicInteger();
    private final AtomicLong synthesizedAudioNanos = new AtomicLong();
    private final AtomicLong firstAudioNanos = new AtomicLong(-1L);
    private final AtomicBoolean truncated = new AtomicBoolean();
    private final AtomicBoolean dirty = new AtomicBoolean();
    private volatile PlaybackState state = PlaybackState.IDLE;

    private final Object publishLock = new Object();
    private boolean finalPublished;
    private ScheduledFuture<?> publication;

    public ProgressTracker(String sessionId, ProgressListener listener, IntSupplier bufferedCount) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.bufferedCount = Objects.requireNonNull(bufferedCount, "bufferedCount must not be null");
    }

    /**
     * Starts periodic publication.
     *
     * @param scheduler scheduler running the publisher
     * @param interval  minimum interval between two published snapshots
     */
    public void startPublishing(TaskScheduler scheduler, Duration interval) {
        Objects.requireNonNull(scheduler, "scheduler must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        synchronized (publishLock) {
            if (publication == null && !finalPublished) {
                publication = scheduler.scheduleAtFixedRate(this::publishIfChanged,
                        Instant.now().plus(interval), interval);
            }
        }
    }

    public void chunkFetched(TextChunk chunk) {
        fetched.incrementAndGet();
        totalEstimate.accumulateAndGet(chunk.index() + 1, Math::max);
        dirty.set(true);
    }

    /**
     * Raises the best-effort total; lower values than the current estimate are ignored.
     */
    public void totalEstimateUpdated(int estimate) {
        totalEstimate.accumulateAndGet(estimate, Math::max);
        dirty.set(true);
    }

    /**
     * Sets the exact total once the source is exhausted.
     */
    public void totalKnown(int total) {
        totalEstimate.set(total);
        dirty.set(true);
    }

    public void chunkSynthesized(AudioArtifact artifact) {
        synthesized.incrementAndGet();
        synthesizedAudioNanos.addAndGet(artifact.durationEstimate().toNanos());
        dirty.set(true);
    }

    public void chunkFailed(int index, FailureReason reason, String detail) {
        failed.incrementAndGet();
        dirty.set(true);
        notifySafely(() -> listener.onChunkFailed(
                new ChunkFailedEvent(sessionId, index, reason, detail, Instant.now())));
    }

    public void playbackStarted(AudioArtifact artifact) {
        played.incrementAndGet();
        firstAudioNanos.compareAndSet(-1L, System.nanoTime());
        dirty.set(true);
    }

    public void playbackRetried(int index) {
        retries.incrementAndGet();
        dirty.set(true);
    }

    public void chunkSkipped(int index) {
        skipped.incrementAndGet();
        dirty.set(true);
    }

    public void markTruncated() {
        truncated.set(true);
        dirty.set(true);
    }

    /**
     * Records a state transition, forwards it, and on a terminal state publishes the final snapshot.
     */
    public void stateChanged(PlaybackState previous, PlaybackState current) {
        state = current;
        dirty.set(true);
        notifySafely(() -> listener.onStateChanged(
                new PlaybackStateChangedEvent(sessionId, previous, current, Instant.now())));
        if (current.isTerminal()) {
            publishFinal();
        }
    }

    /**
     * @return freshly computed snapshot
     */
    public ProgressSnapshot snapshot() {
        int playedNow = played.get();
        int failedNow = failed.get();
        int fetchedNow = fetched.get();
        int total = Math.max(totalEstimate.get(), fetchedNow);
        return new ProgressSnapshot(
                sessionId,
                state,
                fetchedNow,
                synthesized.get(),
                failedNow,
                playedNow,
                bufferedCount.getAsInt(),
                total,
                estimateRemaining(total, playedNow, failedNow),
                truncated.get(),
                timeToFirstAudio(),
                Instant.now());
    }

    public SessionSummary summary() {
        return new SessionSummary(
                sessionId,
                state,
                fetched.get(),
                played.get(),
                failed.get(),
                skipped.get(),
                retries.get(),
                timeToFirstAudio(),
                TimeUtils.elapsed(startNanos),
                truncated.get());
    }

    public int chunksPlayed() {
        return played.get();
    }

    public int chunksFetched() {
        return fetched.get();
    }

    public boolean isTruncated() {
        return truncated.get();
    }

    public String sessionId() {
        return sessionId;
    }

    private Duration estimateRemaining(int total, int playedNow, int failedNow) {
        int synthesizedNow = synthesized.get();
        if (synthesizedNow == 0) {
            return Duration.ZERO;
        }
        long averageNanos = synthesizedAudioNanos.get() / synthesizedNow;
        int remainingChunks = Math.max(0, total - playedNow - failedNow);
        return Duration.ofNanos(averageNanos * remainingChunks);
    }

    private Duration timeToFirstAudio() {
        long first = firstAudioNanos.get();
        return first < 0 ? null : Duration.ofNanos(first - startNanos);
    }

    void publishIfChanged() {
        if (dirty.getAndSet(false)) {
            publish(false);
        }
    }

    private void publishFinal() {
        publish(true);
        cancelPublication();
    }

    private void publish(boolean terminal) {
        synchronized (publishLock) {
            if (finalPublished) {
                return;
            }
            finalPublished = terminal;
            ProgressSnapshot snapshot = snapshot();
            notifySafely(() -> listener.onProgress(new ProgressUpdatedEvent(snapshot, terminal)));
        }
    }

    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed for session {}: {}", sessionId, e.toString());
        }
    }

    private void cancelPublication() {
        synchronized (publishLock) {
            if (publication != null) {
                publication.cancel(false);
                publication = null;
            }
        }
    }

    @Override
    public void close() {
        cancelPublication();
    }
}
