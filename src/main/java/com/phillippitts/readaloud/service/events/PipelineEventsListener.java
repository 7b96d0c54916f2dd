package com.phillippitts.readaloud.service.events;

import com.phillippitts.readaloud.domain.PlaybackState;
import com.phillippitts.readaloud.service.progress.event.ChunkFailedEvent;
import com.phillippitts.readaloud.service.progress.event.PlaybackStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing pipeline problems. Throttled per session and reason so a
 * document whose every chunk fails does not flood the log.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onChunkFailed(ChunkFailedEvent e) {
        String key = "chunk-" + e.sessionId() + '-' + e.reason().label();
        if (shouldLog(key)) {
            LOG.warn("Chunk {} of session {} skipped: reason={}. Check the synthesis engine "
                    + "(synthesis.* properties).", e.index(), e.sessionId(), e.reason().label());
        }
    }

    @EventListener
    void onStateChanged(PlaybackStateChangedEvent e) {
        if (e.current() == PlaybackState.FAILED) {
            LOG.warn("Session {} failed (was {}). See earlier errors for the cause.", e.sessionId(), e.previous());
        }
        if (e.current().isTerminal()) {
            lastLog.keySet().removeIf(key -> key.startsWith("chunk-" + e.sessionId() + '-'));
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
