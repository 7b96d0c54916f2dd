package com.phillippitts.readaloud.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the streaming read-aloud pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Synthesis latency and success/failure counts per engine</li>
 *   <li>Time to first audio per session</li>
 *   <li>Playback retries and skipped chunks</li>
 *   <li>Finished sessions by terminal state</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer under the {@code readaloud} prefix.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class StreamingMetrics {

    private static final String METRIC_PREFIX = "readaloud";

    private final MeterRegistry registry;

    public StreamingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one successful synthesis call.
     *
     * @param engineName name of the engine (process, silent)
     * @param durationNanos duration in nanoseconds
     */
    public void recordSynthesisLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time taken to synthesize one chunk")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSynthesisSuccess(String engineName) {
        Counter.builder(METRIC_PREFIX + ".synthesis.success")
                .description("Number of successfully synthesized chunks")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param engineName name of the engine that failed
     * @param reason failure reason (timeout, engine_error, empty_audio, cancelled)
     */
    public void incrementSynthesisFailure(String engineName, String reason) {
        Counter.builder(METRIC_PREFIX + ".synthesis.failure")
                .description("Number of chunks that failed synthesis")
                .tag("engine", engineName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordTimeToFirstAudio(Duration duration) {
        Timer.builder(METRIC_PREFIX + ".session.first-audio")
                .description("Time from session start to the first played chunk")
                .register(registry)
                .record(duration);
    }

    public void incrementPlaybackRetry(String deviceName) {
        Counter.builder(METRIC_PREFIX + ".playback.retry")
                .description("Number of chunk playbacks retried after a device error")
                .tag("device", deviceName)
                .register(registry)
                .increment();
    }

    public void incrementSkipped() {
        Counter.builder(METRIC_PREFIX + ".playback.skipped")
                .description("Number of chunks skipped by the user")
                .register(registry)
                .increment();
    }

    /**
     * @param state terminal state label (completed, stopped, failed)
     * @param elapsed session wall time
     */
    public void recordSessionFinished(String state, Duration elapsed) {
        Timer.builder(METRIC_PREFIX + ".session.duration")
                .description("Wall time of finished sessions by terminal state")
                .tag("state", state)
                .register(registry)
                .record(elapsed);
    }
}
