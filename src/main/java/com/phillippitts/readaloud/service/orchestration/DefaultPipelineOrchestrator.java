package com.phillippitts.readaloud.service.orchestration;

import com.phillippitts.readaloud.config.pipeline.PipelineSettings;
import com.phillippitts.readaloud.exception.ReadAloudException;
import com.phillippitts.readaloud.service.feed.ContentSource;
import com.phillippitts.readaloud.service.metrics.StreamingMetricsPublisher;
import com.phillippitts.readaloud.service.playback.PlaybackDevice;
import com.phillippitts.readaloud.service.playback.PlaybackDeviceFactory;
import com.phillippitts.readaloud.service.progress.ProgressListener;
import com.phillippitts.readaloud.service.segment.Segmenter;
import com.phillippitts.readaloud.service.synthesis.SynthesisEngine;
import com.phillippitts.readaloud.service.synthesis.TempAudioStore;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link PipelineOrchestrator}: builds each session from shared executors, the configured
 * playback device and the segmenter, and keeps a registry of running sessions.
 *
 * <p><b>Thread Model:</b> feeder, synthesis worker loops and playback loops run on the
 * {@code pipelineExecutor}; individual synthesis calls run on the {@code synthesisExecutor} so
 * they can be abandoned on timeout. Progress is published from the {@code progressScheduler}.
 * Every task carries the session id in the logging context.
 *
 * @see StreamingSession
 */
@Service
public class DefaultPipelineOrchestrator implements PipelineOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultPipelineOrchestrator.class);

    private final Segmenter segmenter;
    private final PlaybackDeviceFactory deviceFactory;
    private final AsyncTaskExecutor pipelineExecutor;
    private final AsyncTaskExecutor synthesisExecutor;
    private final TaskScheduler progressScheduler;
    private final ProgressListener eventListener;
    private final StreamingMetricsPublisher metrics;

    private final Map<String, StreamingSession> sessions = new ConcurrentHashMap<>();

    public DefaultPipelineOrchestrator(Segmenter segmenter,
                                       PlaybackDeviceFactory deviceFactory,
                                       @Qualifier("pipelineExecutor") AsyncTaskExecutor pipelineExecutor,
                                       @Qualifier("synthesisExecutor") AsyncTaskExecutor synthesisExecutor,
                                       @Qualifier("progressScheduler") TaskScheduler progressScheduler,
                                       ProgressListener eventListener,
                                       StreamingMetricsPublisher metrics) {
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter must not be null");
        this.deviceFactory = Objects.requireNonNull(deviceFactory, "deviceFactory must not be null");
        this.pipelineExecutor = Objects.requireNonNull(pipelineExecutor, "pipelineExecutor must not be null");
        this.synthesisExecutor = Objects.requireNonNull(synthesisExecutor, "synthesisExecutor must not be null");
        this.progressScheduler = Objects.requireNonNull(progressScheduler, "progressScheduler must not be null");
        this.eventListener = Objects.requireNonNull(eventListener, "eventListener must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public StreamingSession start(ContentSource source, SynthesisEngine engine, PipelineSettings settings,
                                  ProgressListener listener) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        String sessionId = UUID.randomUUID().toString();
        try (CloseableThreadContext.Instance ignored =
                     CloseableThreadContext.put(StreamingSession.SESSION_ID_KEY, sessionId)) {
            if (!engine.isHealthy()) {
                LOG.warn("Engine '{}' reports unhealthy; chunks are likely to fail", engine.getEngineName());
            }
            LOG.info("Starting session for source {} (engine={}, device={}, workers={}, voice={})",
                    source.sourceId(), engine.getEngineName(), deviceFactory.getDeviceName(),
                    settings.workers(), settings.voice().voice());

            TempAudioStore store = createStore(sessionId, source);
            PlaybackDevice device;
            try {
                device = deviceFactory.create(sessionId);
            } catch (RuntimeException e) {
                store.close();
                closeQuietly(source);
                throw e;
            }
            StreamingSession session = new StreamingSession(sessionId, source, engine, settings,
                    ProgressListener.composite(List.of(eventListener, listener)), segmenter, device, store,
                    pipelineExecutor, synthesisExecutor, metrics, this::onFinished);
            sessions.put(sessionId, session);
            session.launch(pipelineExecutor, progressScheduler);
            return session;
        }
    }

    private TempAudioStore createStore(String sessionId, ContentSource source) {
        try {
            return TempAudioStore.create(sessionId);
        } catch (UncheckedIOException e) {
            closeQuietly(source);
            throw new ReadAloudException("Cannot create temp audio directory for session " + sessionId, e);
        }
    }

    private void onFinished(StreamingSession session) {
        sessions.remove(session.id());
    }

    @Override
    public Optional<StreamingSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<StreamingSession> activeSessions() {
        List<StreamingSession> active = new ArrayList<>(sessions.values());
        active.sort(Comparator.comparing(StreamingSession::startedAt));
        return active;
    }

    /**
     * Stops every running session on shutdown.
     */
    @PreDestroy
    public void shutdown() {
        List<StreamingSession> active = activeSessions();
        if (!active.isEmpty()) {
            LOG.info("Shutting down with {} active session(s); stopping them", active.size());
        }
        active.forEach(StreamingSession::stop);
    }

    private static void closeQuietly(ContentSource source) {
        try {
            source.close();
        } catch (IOException e) {
            LOG.debug("Failed to close source {}: {}", source.sourceId(), e.toString());
        }
    }
}
