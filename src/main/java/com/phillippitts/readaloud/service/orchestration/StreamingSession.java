package com.phillippitts.readaloud.service.orchestration;

import com.phillippitts.readaloud.config.pipeline.PipelineSettings;
import com.phillippitts.readaloud.domain.PlaybackState;
import com.phillippitts.readaloud.domain.ProgressSnapshot;
import com.phillippitts.readaloud.exception.FetchException;
import com.phillippitts.readaloud.exception.ReadAloudException;
import com.phillippitts.readaloud.service.buffer.BufferOccupancy;
import com.phillippitts.readaloud.service.buffer.PlaybackBuffer;
import com.phillippitts.readaloud.service.buffer.ReorderBuffer;
import com.phillippitts.readaloud.service.buffer.WorkQueue;
import com.phillippitts.readaloud.service.feed.ContentFeeder;
import com.phillippitts.readaloud.service.feed.ContentSource;
import com.phillippitts.readaloud.service.feed.FeedResult;
import com.phillippitts.readaloud.service.metrics.StreamingMetricsPublisher;
import com.phillippitts.readaloud.service.playback.PlaybackController;
import com.phillippitts.readaloud.service.playback.PlaybackDevice;
import com.phillippitts.readaloud.service.playback.PlaybackStateMachine;
import com.phillippitts.readaloud.service.progress.ProgressListener;
import com.phillippitts.readaloud.service.progress.ProgressTracker;
import com.phillippitts.readaloud.service.progress.SessionSummary;
import com.phillippitts.readaloud.service.segment.Segmenter;
import com.phillippitts.readaloud.service.synthesis.SynthesisEngine;
import com.phillippitts.readaloud.service.synthesis.SynthesisWorkerPool;
import com.phillippitts.readaloud.service.synthesis.TempAudioStore;
import com.phillippitts.readaloud.util.CancellationSignal;
import com.phillippitts.readaloud.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One running read-aloud session and the handle callers control it with.
 *
 * <p><b>Tasks:</b> a feeder task fills the work queue, the synthesis workers fill the reorder and
 * playback buffers, and the playback task plays. Closing propagates downstream: the feeder closes
 * the work queue when the source is exhausted, the last worker closes the playback buffer, and the
 * playback loop ends once that buffer is drained.
 *
 * <p><b>Outcome:</b> the session ends {@code COMPLETED} when playback drains normally and at least
 * one chunk played (a source failure after that only marks it truncated), {@code FAILED} when
 * nothing could be played or a chunk failed playback twice, and {@code STOPPED} on
 * {@link #stop()}.
 *
 * <p><b>Cleanup:</b> when both the workers and the playback loop have exited, buffered audio and
 * the temp directory are deleted, the device and source are closed and {@link #completion()}
 * completes with the terminal state.
 */
public final class StreamingSession {

    private static final Logger LOG = LogManager.getLogger(StreamingSession.class);

    static final String SESSION_ID_KEY = "sessionId";

    private final String id;
    private final String sourceId;
    private final Instant startedAt = Instant.now();
    private final long startNanos = System.nanoTime();
    private final ContentSource source;
    private final SynthesisEngine engine;
    private final PipelineSettings settings;
    private final PlaybackDevice device;
    private final TempAudioStore store;
    private final StreamingMetricsPublisher metrics;
    private final Consumer<StreamingSession> onFinished;

    private final CancellationSignal cancellation = new CancellationSignal();
    private final WorkQueue workQueue;
    private final BufferOccupancy occupancy;
    private final PlaybackBuffer playbackBuffer;
    private final ReorderBuffer reorderBuffer;
    private final ProgressTracker tracker;
    private final PlaybackStateMachine stateMachine;
    private final ContentFeeder feeder;
    private final SynthesisWorkerPool workerPool;
    private final PlaybackController controller;

    private final CompletableFuture<PlaybackState> completion = new CompletableFuture<>();
    // Workers (as a group) and the playback loop
    private final AtomicInteger liveTasks = new AtomicInteger(2);
    private final AtomicBoolean sourceClosed = new AtomicBoolean();
    private volatile Throwable failureCause;
    private volatile FetchException fetchError;

    StreamingSession(String id,
                     ContentSource source,
                     SynthesisEngine engine,
                     PipelineSettings settings,
                     ProgressListener listener,
                     Segmenter segmenter,
                     PlaybackDevice device,
                     TempAudioStore store,
                     AsyncTaskExecutor pipelineExecutor,
                     AsyncTaskExecutor synthesisExecutor,
                     StreamingMetricsPublisher metrics,
                     Consumer<StreamingSession> onFinished) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.sourceId = source.sourceId();
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.onFinished = Objects.requireNonNull(onFinished, "onFinished must not be null");

        this.workQueue = new WorkQueue(settings.workQueueCapacity(), cancellation);
        this.occupancy = new BufferOccupancy(settings.highWatermark(), cancellation);
        this.playbackBuffer = new PlaybackBuffer(settings.playbackCapacity(), settings.lowWatermark(),
                occupancy, cancellation);
        this.reorderBuffer = new ReorderBuffer(playbackBuffer, occupancy);
        this.tracker = new ProgressTracker(id, listener, playbackBuffer::size);
        this.stateMachine = new PlaybackStateMachine(this::onTransition);
        this.feeder = new ContentFeeder(segmenter, settings);
        this.workerPool = new SynthesisWorkerPool(engine, pipelineExecutor, synthesisExecutor, settings,
                store, tracker, metrics, cancellation);
        this.controller = new PlaybackController(playbackBuffer, device, stateMachine, tracker, store,
                metrics, cancellation);
        cancellation.onCancel(this::closeSource);
    }

    /**
     * Launches feeder, workers and playback loop.
     *
     * @throws ReadAloudException if the pipeline executor has no room for the session
     */
    void launch(AsyncTaskExecutor pipelineExecutor, TaskScheduler scheduler) {
        stateMachine.transition(PlaybackState.FETCHING);
        tracker.startPublishing(scheduler, settings.publishInterval());

        boolean controllerLaunched = false;
        boolean workersLaunched = false;
        try {
            pipelineExecutor.submit(this::runPlayback);
            controllerLaunched = true;
            workerPool.start(workQueue, occupancy, reorderBuffer).whenComplete(this::onWorkersDone);
            workersLaunched = true;
            pipelineExecutor.submit(this::runFeeder);
        } catch (RejectedExecutionException e) {
            fail(e);
            workQueue.close();
            if (!controllerLaunched) {
                taskFinished();
            }
            if (!workersLaunched) {
                taskFinished();
            }
            throw new ReadAloudException("Pipeline executor saturated; session " + id + " not started", e);
        }
    }

    private void runFeeder() {
        try {
            FeedResult result = feeder.feed(source, workQueue, tracker, cancellation);
            if (result.capped()) {
                tracker.markTruncated();
            }
            LOG.info("Source {} fully read: {} chunks", sourceId, result.chunksEmitted());
        } catch (FetchException e) {
            fetchError = e;
            tracker.markTruncated();
            LOG.warn("Source {} failed; playing what was read: {}", sourceId, e.getMessage());
        } catch (CancellationException e) {
            LOG.debug("Feeder cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Feeder interrupted");
        } catch (RuntimeException e) {
            fail(e);
        } finally {
            workQueue.close();
            closeSource();
        }
    }

    private void onWorkersDone(Void ignored, Throwable error) {
        try {
            if (error != null) {
                fail(error);
            } else {
                playbackBuffer.close();
            }
        } finally {
            taskFinished();
        }
    }

    private void runPlayback() {
        try {
            controller.run();
            playbackDrained();
        } catch (CancellationException e) {
            LOG.debug("Playback cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Playback interrupted");
        } catch (RuntimeException e) {
            fail(e);
        } finally {
            taskFinished();
        }
    }

    private void playbackDrained() {
        if (tracker.chunksPlayed() > 0) {
            stateMachine.terminate(PlaybackState.COMPLETED);
            return;
        }
        Throwable cause = fetchError != null ? fetchError
                : new ReadAloudException("No chunk could be synthesized and played");
        fail(cause);
    }

    private void fail(Throwable cause) {
        if (stateMachine.terminate(PlaybackState.FAILED)) {
            failureCause = cause;
            LOG.error("Session failed: {}", cause.getMessage(), cause);
        }
        cancellation.cancel();
    }

    private void onTransition(PlaybackState previous, PlaybackState current) {
        LOG.debug("State {} -> {}", previous, current);
        tracker.stateChanged(previous, current);
    }

    private void taskFinished() {
        if (liveTasks.decrementAndGet() == 0) {
            finish();
        }
    }

    private void finish() {
        stateMachine.terminate(PlaybackState.STOPPED);
        cancellation.cancel();
        playbackBuffer.drainAll().forEach(store::release);
        reorderBuffer.discardPending().forEach(store::release);
        tracker.close();
        closeDevice();
        store.close();
        closeSource();

        PlaybackState state = stateMachine.current();
        SessionSummary summary = tracker.summary();
        LOG.info("Session finished: state={}, played={}, failed={}, skipped={}, retries={}, truncated={}, "
                        + "firstAudio={}, elapsed={}",
                state, summary.chunksPlayed(), summary.chunksFailed(), summary.chunksSkipped(),
                summary.playbackRetries(), summary.truncated(),
                summary.timeToFirstAudio() == null ? "n/a" : TimeUtils.formatSeconds(summary.timeToFirstAudio()),
                TimeUtils.formatSeconds(summary.elapsed()));
        metrics.recordSessionFinished(state, summary.elapsed());
        try {
            onFinished.accept(this);
        } finally {
            completion.complete(state);
        }
    }

    private void closeDevice() {
        try {
            device.close();
        } catch (RuntimeException e) {
            LOG.warn("Failed to close device {}: {}", device.getDeviceName(), e.getMessage());
        }
    }

    private void closeSource() {
        if (!sourceClosed.compareAndSet(false, true)) {
            return;
        }
        try {
            source.close();
        } catch (IOException e) {
            LOG.warn("Failed to close source {}: {}", sourceId, e.toString());
        }
    }

    // ---- handle API ----

    public String id() {
        return id;
    }

    public String sourceId() {
        return sourceId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public PlaybackState state() {
        return stateMachine.current();
    }

    /**
     * @return best-effort total chunk count, empty while nothing is known
     */
    public OptionalInt totalChunksEstimate() {
        int total = tracker.snapshot().totalChunksEstimate();
        return total > 0 ? OptionalInt.of(total) : OptionalInt.empty();
    }

    public ProgressSnapshot progress() {
        return tracker.snapshot();
    }

    public SessionSummary summary() {
        return tracker.summary();
    }

    public String engineName() {
        return engine.getEngineName();
    }

    public String deviceName() {
        return device.getDeviceName();
    }

    public Duration elapsed() {
        return TimeUtils.elapsed(startNanos);
    }

    public boolean isPaused() {
        return controller.isPaused();
    }

    public void pause() {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(SESSION_ID_KEY, id)) {
            controller.pause();
        }
    }

    public void resume() {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(SESSION_ID_KEY, id)) {
            controller.resume();
        }
    }

    /**
     * @return {@code true} if a chunk was playing and got skipped
     */
    public boolean skip() {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(SESSION_ID_KEY, id)) {
            return controller.skip();
        }
    }

    /**
     * Stops the session. Idempotent; returns before cleanup has finished.
     */
    public void stop() {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(SESSION_ID_KEY, id)) {
            controller.stop();
        }
    }

    /**
     * @return future completing with the terminal state once all resources are released
     */
    public CompletableFuture<PlaybackState> completion() {
        return completion.copy();
    }

    /**
     * Blocks until the session has ended and released its resources.
     *
     * @throws TimeoutException if the session is still running after {@code timeout}
     */
    public PlaybackState awaitTermination(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Session completion failed", e.getCause());
        }
    }

    /**
     * @return why the session failed, if it did
     */
    public Optional<Throwable> failureCause() {
        return Optional.ofNullable(failureCause);
    }

    @Override
    public String toString() {
        return "StreamingSession{id=" + id + ", source=" + sourceId + ", state=" + state() + "}";
    }
}
