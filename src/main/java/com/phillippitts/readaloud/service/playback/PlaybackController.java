package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.domain.PlaybackState;
import com.phillippitts.readaloud.exception.InvalidStateTransitionException;
import com.phillippitts.readaloud.exception.PlaybackException;
import com.phillippitts.readaloud.service.buffer.PlaybackBuffer;
import com.phillippitts.readaloud.service.metrics.StreamingMetricsPublisher;
import com.phillippitts.readaloud.service.progress.ProgressTracker;
import com.phillippitts.readaloud.service.synthesis.TempAudioStore;
import com.phillippitts.readaloud.util.CancellationSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Plays a session's artifacts in order, one at a time.
 *
 * <p>{@link #run()} is the single playback loop: take the next artifact from the playback buffer,
 * play it to completion, move on. Failed artifacts are skipped. While an artifact plays, the next
 * one is taken from the buffer and opened ahead of time so consecutive chunks follow each other
 * without a gap.
 *
 * <p>The loop waits for the buffer's low watermark (state {@code BUFFERING}) before the first
 * playback and after every underrun, unless the upstream has finished.
 *
 * <p>{@link #pause()}, {@link #resume()}, {@link #skip()} and {@link #stop()} may be called from
 * any thread while the loop runs.
 *
 * <p>A device error is retried once on the same artifact; a second error ends the loop with
 * {@link PlaybackException}.
 */
public final class PlaybackController {

    private static final Logger LOG = LogManager.getLogger(PlaybackController.class);

    static final Duration COMPLETION_POLL = Duration.ofMillis(50);
    static final int MAX_PLAYBACK_ATTEMPTS = 2;

    private final PlaybackBuffer buffer;
    private final PlaybackDevice device;
    private final PlaybackStateMachine stateMachine;
    private final ProgressTracker tracker;
    private final TempAudioStore store;
    private final StreamingMetricsPublisher metrics;
    private final CancellationSignal cancellation;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition resumed = lock.newCondition();
    private boolean paused;
    private boolean skipRequested;
    private Playback current;

    // Playback loop thread only
    private Prepared prepared;
    private boolean primed;
    private boolean firstAudioRecorded;
    private int lastCountedIndex = -1;

    public PlaybackController(PlaybackBuffer buffer,
                              PlaybackDevice device,
                              PlaybackStateMachine stateMachine,
                              ProgressTracker tracker,
                              TempAudioStore store,
                              StreamingMetricsPublisher metrics,
                              CancellationSignal cancellation) {
        this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
        cancellation.onCancel(this::onCancelled);
    }

    /**
     * Runs the playback loop until the buffer is closed and drained.
     *
     * @throws InterruptedException if the loop thread is interrupted
     * @throws CancellationException if the session is cancelled
     * @throws PlaybackException if an artifact fails to play twice in a row
     */
    public void run() throws InterruptedException {
        try {
            while (true) {
                Prepared next = takeNext();
                if (next == null) {
                    LOG.debug("Playback buffer drained");
                    return;
                }
                AudioArtifact artifact = next.artifact();
                if (!artifact.isReady()) {
                    LOG.info("Skipping chunk {}: synthesis failed ({})", artifact.index(),
                            artifact.failureReason().label());
                    continue;
                }
                playWithRetry(artifact, next.playback());
            }
        } finally {
            discardPrepared();
        }
    }

    private Prepared takeNext() throws InterruptedException {
        if (prepared != null) {
            Prepared next = prepared;
            prepared = null;
            return next;
        }
        if (!primed || buffer.isEmpty()) {
            if (buffer.size() < buffer.lowWatermark()) {
                stateMachine.transitionIf(EnumSet.of(PlaybackState.FETCHING, PlaybackState.PLAYING),
                        PlaybackState.BUFFERING);
            }
            if (!buffer.awaitLowWatermark()) {
                return null;
            }
            primed = true;
        }
        Optional<AudioArtifact> next = buffer.dequeue();
        return next.map(artifact -> new Prepared(artifact, null)).orElse(null);
    }

    private void playWithRetry(AudioArtifact artifact, Playback opened) throws InterruptedException {
        Playback playback = opened;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                if (playback == null) {
                    playback = device.open(artifact);
                }
                play(artifact, playback);
                store.release(artifact);
                return;
            } catch (PlaybackException e) {
                closeQuietly(playback);
                playback = null;
                if (attempt >= MAX_PLAYBACK_ATTEMPTS) {
                    store.release(artifact);
                    LOG.error("Playback of chunk {} failed again: {}", artifact.index(), e.getMessage());
                    throw e;
                }
                cancellation.throwIfCancelled();
                LOG.warn("Playback of chunk {} failed, retrying once: {}", artifact.index(), e.getMessage());
                tracker.playbackRetried(artifact.index());
                metrics.recordPlaybackRetry(device.getDeviceName());
            }
        }
    }

    /**
     * Plays one artifact to completion. A retried artifact is counted as played only once.
     */
    private void play(AudioArtifact artifact, Playback playback) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (paused && !cancellation.isCancelled()) {
                resumed.await();
            }
            cancellation.throwIfCancelled();
            skipRequested = false;
            current = playback;
            try {
                playback.start();
            } catch (RuntimeException e) {
                current = null;
                throw e;
            }
            stateMachine.transitionIf(EnumSet.of(PlaybackState.FETCHING, PlaybackState.BUFFERING),
                    PlaybackState.PLAYING);
        } finally {
            lock.unlock();
        }

        if (artifact.index() != lastCountedIndex) {
            lastCountedIndex = artifact.index();
            tracker.playbackStarted(artifact);
            recordFirstAudio();
        }
        LOG.debug("Playing chunk {} on {}", artifact.index(), device.getDeviceName());

        boolean skipped;
        try {
            while (!playback.awaitCompletion(COMPLETION_POLL)) {
                cancellation.throwIfCancelled();
                prepareNext();
            }
        } finally {
            lock.lock();
            try {
                current = null;
                skipped = skipRequested;
                skipRequested = false;
            } finally {
                lock.unlock();
            }
            playback.close();
        }
        cancellation.throwIfCancelled();
        if (skipped) {
            LOG.info("Skipped chunk {}", artifact.index());
            tracker.chunkSkipped(artifact.index());
            metrics.recordSkipped();
        }
    }

    private void recordFirstAudio() {
        if (firstAudioRecorded) {
            return;
        }
        firstAudioRecorded = true;
        Duration firstAudio = tracker.snapshot().timeToFirstAudio();
        metrics.recordTimeToFirstAudio(firstAudio);
        LOG.info("First audio after {} ms", firstAudio == null ? -1 : firstAudio.toMillis());
    }

    private void prepareNext() {
        if (prepared != null || cancellation.isCancelled()) {
            return;
        }
        Optional<AudioArtifact> polled = buffer.poll();
        if (polled.isEmpty()) {
            return;
        }
        AudioArtifact next = polled.get();
        if (!next.isReady()) {
            prepared = new Prepared(next, null);
            return;
        }
        try {
            prepared = new Prepared(next, device.open(next));
        } catch (PlaybackException e) {
            // Opened again, with retry, when its turn comes
            LOG.debug("Could not pre-open chunk {}: {}", next.index(), e.getMessage());
            prepared = new Prepared(next, null);
        }
    }

    private void discardPrepared() {
        if (prepared != null) {
            closeQuietly(prepared.playback());
            store.release(prepared.artifact());
            prepared = null;
        }
    }

    /**
     * Halts the current chunk and enters {@code PAUSED}. Pausing while paused is a no-op.
     *
     * @throws InvalidStateTransitionException if the session cannot be paused in its current state
     */
    public void pause() {
        lock.lock();
        try {
            if (paused) {
                return;
            }
            stateMachine.transition(PlaybackState.PAUSED);
            paused = true;
            if (current != null) {
                current.pause();
            }
        } finally {
            lock.unlock();
        }
        LOG.info("Playback paused");
    }

    /**
     * Continues from the paused point. Resuming while not paused is a no-op.
     *
     * @throws InvalidStateTransitionException if the session already ended
     */
    public void resume() {
        lock.lock();
        try {
            PlaybackState state = stateMachine.current();
            if (state.isTerminal()) {
                throw new InvalidStateTransitionException(state, PlaybackState.PLAYING);
            }
            if (!paused) {
                return;
            }
            paused = false;
            if (current != null) {
                stateMachine.transition(PlaybackState.PLAYING);
                current.resume();
            } else {
                // Between chunks; the loop moves to PLAYING when the next one starts
                stateMachine.transition(PlaybackState.BUFFERING);
            }
            resumed.signalAll();
        } finally {
            lock.unlock();
        }
        LOG.info("Playback resumed");
    }

    /**
     * Ends the current chunk early and continues with the next one. The session stays paused if
     * it was paused.
     *
     * @return {@code true} if a chunk was playing
     * @throws InvalidStateTransitionException if the session already ended
     */
    public boolean skip() {
        Playback toSkip;
        lock.lock();
        try {
            PlaybackState state = stateMachine.current();
            if (state.isTerminal()) {
                throw new InvalidStateTransitionException(state, state);
            }
            toSkip = current;
            if (toSkip == null) {
                LOG.debug("Skip requested with no chunk playing");
                return false;
            }
            skipRequested = true;
        } finally {
            lock.unlock();
        }
        toSkip.stop();
        return true;
    }

    /**
     * Stops playback immediately, moves the session to {@code STOPPED} and releases buffered audio.
     * Idempotent; a session that already ended keeps its terminal state.
     */
    public void stop() {
        boolean stopped = stateMachine.terminate(PlaybackState.STOPPED);
        cancellation.cancel();
        buffer.drainAll().forEach(store::release);
        if (stopped) {
            LOG.info("Playback stopped after {} chunks", tracker.chunksPlayed());
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    private void onCancelled() {
        Playback toStop;
        lock.lock();
        try {
            toStop = current;
            resumed.signalAll();
        } finally {
            lock.unlock();
        }
        if (toStop != null) {
            toStop.stop();
        }
    }

    private static void closeQuietly(Playback playback) {
        if (playback == null) {
            return;
        }
        try {
            playback.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing playback: {}", e.toString());
        }
    }

    private record Prepared(AudioArtifact artifact, Playback playback) {
    }
}
