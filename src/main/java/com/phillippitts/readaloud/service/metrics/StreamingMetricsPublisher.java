package com.phillippitts.readaloud.service.metrics;

import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.domain.PlaybackState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Null-safe facade over {@link StreamingMetrics} used by the pipeline components.
 *
 * <p>Components never check for metrics support themselves: they receive either the Spring bean
 * or {@link #NOOP}.
 *
 * @see StreamingMetrics
 */
@Component
public final class StreamingMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(StreamingMetricsPublisher.class);

    /**
     * No-op instance for tests and builder defaults.
     */
    public static final StreamingMetricsPublisher NOOP = new StreamingMetricsPublisher(null);

    private final StreamingMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public StreamingMetricsPublisher(StreamingMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("StreamingMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSynthesisSuccess(String engineName, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordSynthesisLatency(engineName, durationNanos);
        metrics.incrementSynthesisSuccess(engineName);
    }

    public void recordSynthesisFailure(String engineName, FailureReason reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSynthesisFailure(engineName, reason.label());
    }

    public void recordTimeToFirstAudio(Duration duration) {
        if (metrics == null || duration == null) {
            return;
        }
        metrics.recordTimeToFirstAudio(duration);
    }

    public void recordPlaybackRetry(String deviceName) {
        if (metrics == null) {
            return;
        }
        metrics.incrementPlaybackRetry(deviceName);
    }

    public void recordSkipped() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSkipped();
    }

    public void recordSessionFinished(PlaybackState state, Duration elapsed) {
        if (metrics == null) {
            return;
        }
        metrics.recordSessionFinished(state.name().toLowerCase(Locale.ROOT), elapsed);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
