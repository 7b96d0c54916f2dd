package com.phillippitts.readaloud.service.synthesis;

import com.phillippitts.readaloud.config.pipeline.PipelineSettings;
import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.domain.TextChunk;
import com.phillippitts.readaloud.exception.SynthesisException;
import com.phillippitts.readaloud.service.buffer.BufferOccupancy;
import com.phillippitts.readaloud.service.buffer.ReorderBuffer;
import com.phillippitts.readaloud.service.buffer.WorkQueue;
import com.phillippitts.readaloud.service.metrics.StreamingMetricsPublisher;
import com.phillippitts.readaloud.service.progress.ProgressTracker;
import com.phillippitts.readaloud.util.CancellationSignal;
import com.phillippitts.readaloud.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.AsyncTaskExecutor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the synthesis workers of one session.
 *
 * <p>Each worker loops: wait until the combined reorder + playback occupancy is below the high
 * watermark, take the next chunk from the work queue, synthesize it, insert the resulting artifact
 * into the reorder buffer. A worker exits when the queue is closed and drained, or on cancellation.
 *
 * <p><b>Thread model:</b> worker loops run on the pipeline executor. Each synthesis call is
 * submitted to the synthesis executor, which may queue it behind other sessions' calls. The
 * per-chunk timeout starts once the call begins running; a call that times out is cancelled with
 * interruption and the chunk becomes a failed artifact. A late result of an
 * abandoned call is never observed, because the worker has already moved on.
 *
 * <p><b>Error handling:</b> every chunk taken from the queue produces exactly one artifact, ready
 * or failed, so the reorder buffer never waits on an index that will not arrive.
 */
public final class SynthesisWorkerPool {

    private static final Logger LOG = LogManager.getLogger(SynthesisWorkerPool.class);

    private static final int LOG_PREVIEW_CHARS = 40;
    private static final long START_POLL_MS = 100L;

    private final SynthesisEngine engine;
    private final AsyncTaskExecutor loopExecutor;
    private final AsyncTaskExecutor callExecutor;
    private final PipelineSettings settings;
    private final TempAudioStore store;
    private final ProgressTracker tracker;
    private final StreamingMetricsPublisher metrics;
    private final CancellationSignal cancellation;

    private final List<WorkerLoop> loops = new ArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    public SynthesisWorkerPool(SynthesisEngine engine,
                               AsyncTaskExecutor loopExecutor,
                               AsyncTaskExecutor callExecutor,
                               PipelineSettings settings,
                               TempAudioStore store,
                               ProgressTracker tracker,
                               StreamingMetricsPublisher metrics,
                               CancellationSignal cancellation) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.loopExecutor = Objects.requireNonNull(loopExecutor, "loopExecutor must not be null");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    /**
     * Launches the configured number of workers.
     *
     * @param queue     source of chunks
     * @param occupancy shared reorder + playback occupancy
     * @param reorder   destination of artifacts
     * @return future completing once every worker has exited; completes exceptionally if a worker
     *         died from an unexpected error
     */
    public CompletableFuture<Void> start(WorkQueue queue, BufferOccupancy occupancy, ReorderBuffer reorder) {
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(occupancy, "occupancy must not be null");
        Objects.requireNonNull(reorder, "reorder must not be null");
        int workers = settings.workers();
        running.set(workers);
        synchronized (loops) {
            for (int i = 0; i < workers; i++) {
                WorkerLoop loop = new WorkerLoop(i);
                loops.add(loop);
                try {
                    loop.future = loopExecutor.submit(() -> {
                        if (loop.claim()) {
                            runWorker(loop.workerId, queue, occupancy, reorder);
                        }
                    });
                } catch (RejectedExecutionException e) {
                    LOG.error("Pipeline executor rejected synthesis worker {}", i, e);
                    failure.compareAndSet(null, e);
                    if (loop.claim()) {
                        workerExited();
                    }
                }
            }
        }
        cancellation.onCancel(this::interruptWorkers);
        LOG.debug("Started {} synthesis workers using engine '{}'", workers, engine.getEngineName());
        return done;
    }

    private void runWorker(int workerId, WorkQueue queue, BufferOccupancy occupancy, ReorderBuffer reorder) {
        try {
            while (true) {
                occupancy.awaitBelowHighWatermark();
                Optional<TextChunk> next = queue.take();
                if (next.isEmpty()) {
                    break;
                }
                AudioArtifact artifact = synthesizeChunk(workerId, next.get());
                reorder.insert(artifact);
            }
            LOG.debug("Synthesis worker {} finished", workerId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Synthesis worker {} interrupted", workerId);
        } catch (CancellationException e) {
            LOG.debug("Synthesis worker {} cancelled", workerId);
        } catch (RuntimeException e) {
            LOG.error("Synthesis worker {} failed unexpectedly", workerId, e);
            failure.compareAndSet(null, e);
        } finally {
            workerExited();
        }
    }

    /**
     * Synthesizes one chunk, retrying once if configured.
     *
     * @return ready artifact, or a failed artifact carrying the last failure reason
     * @throws InterruptedException if the worker is interrupted
     * @throws CancellationException if the session is cancelled
     */
    AudioArtifact synthesizeChunk(int workerId, TextChunk chunk) throws InterruptedException {
        int attempts = settings.retryFailedOnce() ? 2 : 1;
        SynthesisException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            cancellation.throwIfCancelled();
            Path output = store.fileFor(chunk.index(), attempt);
            AtomicLong startedAt = new AtomicLong();
            try {
                SynthesisResult result = callWithTimeout(chunk, output, startedAt);
                long elapsed = System.nanoTime() - startedAt.get();
                metrics.recordSynthesisSuccess(engine.getEngineName(), elapsed);
                AudioArtifact artifact = AudioArtifact.ready(chunk.index(), result.audio(), result.durationEstimate());
                tracker.chunkSynthesized(artifact);
                LOG.debug("Worker {} synthesized chunk {} in {} ms", workerId, chunk.index(),
                        elapsed / 1_000_000L);
                return artifact;
            } catch (SynthesisException e) {
                store.delete(output);
                last = e;
                if (attempt < attempts) {
                    LOG.info("Chunk {} failed ({}), retrying once", chunk.index(), e.getReason().label());
                }
            }
        }
        FailureReason reason = last.getReason();
        LOG.warn("Chunk {} failed synthesis [{}] \"{}\": {}", chunk.index(), reason.label(),
                LogSanitizer.preview(chunk.text(), LOG_PREVIEW_CHARS), last.getMessage());
        metrics.recordSynthesisFailure(engine.getEngineName(), reason);
        tracker.chunkFailed(chunk.index(), reason, last.getMessage());
        return AudioArtifact.failed(chunk.index(), reason, last.getMessage());
    }

    private SynthesisResult callWithTimeout(TextChunk chunk, Path output, AtomicLong startedAt)
            throws InterruptedException {
        long timeoutMs = settings.synthesisTimeout().toMillis();
        CountDownLatch started = new CountDownLatch(1);
        Future<SynthesisResult> call;
        try {
            call = callExecutor.submit(() -> {
                startedAt.set(System.nanoTime());
                started.countDown();
                return engine.synthesize(chunk.text(), settings.voice(), output);
            });
        } catch (RejectedExecutionException e) {
            throw new SynthesisException("Synthesis executor rejected chunk " + chunk.index(),
                    engine.getEngineName(), FailureReason.ENGINE_ERROR, e);
        }
        try {
            awaitStart(call, started);
            return call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new SynthesisException("Timed out after " + timeoutMs + " ms",
                    engine.getEngineName(), FailureReason.TIMEOUT, e);
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        } catch (CancellationException e) {
            throw new SynthesisException("Synthesis call cancelled", engine.getEngineName(),
                    FailureReason.CANCELLED, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SynthesisException se) {
                throw se;
            }
            throw new SynthesisException("Unexpected engine error: " + cause,
                    engine.getEngineName(), FailureReason.ENGINE_ERROR, cause);
        }
    }

    /**
     * Waits until the call leaves the executor queue. Time spent queued does not count against
     * the per-chunk timeout.
     */
    private static void awaitStart(Future<?> call, CountDownLatch started) throws InterruptedException {
        while (!started.await(START_POLL_MS, TimeUnit.MILLISECONDS)) {
            if (call.isDone()) {
                return;
            }
        }
    }

    private void interruptWorkers() {
        synchronized (loops) {
            for (WorkerLoop loop : loops) {
                if (loop.claim()) {
                    // Never started; it will not run now
                    workerExited();
                }
                if (loop.future != null) {
                    loop.future.cancel(true);
                }
            }
        }
    }

    private void workerExited() {
        if (running.decrementAndGet() != 0) {
            return;
        }
        Throwable error = failure.get();
        if (error != null) {
            done.completeExceptionally(error);
        } else {
            done.complete(null);
        }
    }

    private static final class WorkerLoop {
        private final int workerId;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private Future<?> future;

        WorkerLoop(int workerId) {
            this.workerId = workerId;
        }

        boolean claim() {
            return claimed.compareAndSet(false, true);
        }
    }
}
