package com.phillippitts.readaloud.service.orchestration;

import com.phillippitts.readaloud.config.pipeline.PipelineSettings;
import com.phillippitts.readaloud.exception.SessionNotFoundException;
import com.phillippitts.readaloud.service.feed.ContentSource;
import com.phillippitts.readaloud.service.progress.ProgressListener;
import com.phillippitts.readaloud.service.synthesis.SynthesisEngine;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for streaming read-aloud sessions.
 *
 * <p>Every started session runs independently: its own buffers, workers, playback loop and
 * cancellation signal. Sessions stay registered until they reach a terminal state and have
 * released their resources.
 */
public interface PipelineOrchestrator {

    /**
     * Starts reading a source aloud. Returns as soon as the session's tasks are launched.
     *
     * @param source   text to read; closed by the session when it ends
     * @param engine   synthesis engine
     * @param settings per-session pipeline settings
     * @param listener receives this session's progress, in addition to application events
     * @return handle of the running session
     */
    StreamingSession start(ContentSource source, SynthesisEngine engine, PipelineSettings settings,
                           ProgressListener listener);

    default StreamingSession start(ContentSource source, SynthesisEngine engine, PipelineSettings settings) {
        return start(source, engine, settings, ProgressListener.NOOP);
    }

    /**
     * Stops a session; equivalent to {@link StreamingSession#stop()}.
     */
    default void cancel(StreamingSession session) {
        session.stop();
    }

    /**
     * @throws SessionNotFoundException if no running session has this id
     */
    default void cancel(String sessionId) {
        get(sessionId).stop();
    }

    Optional<StreamingSession> find(String sessionId);

    /**
     * @throws SessionNotFoundException if no running session has this id
     */
    default StreamingSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * @return running sessions, oldest first
     */
    List<StreamingSession> activeSessions();
}
