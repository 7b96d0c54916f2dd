package com.phillippitts.readaloud.service.health;

import com.phillippitts.readaloud.service.orchestration.PipelineOrchestrator;
import com.phillippitts.readaloud.service.playback.PlaybackDeviceFactory;
import com.phillippitts.readaloud.service.synthesis.SynthesisEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the synthesis engine and playback device.
 *
 * <ul>
 *   <li>UP: engine healthy and device available</li>
 *   <li>DEGRADED: one of the two unavailable</li>
 *   <li>DOWN: neither available</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ReadAloudHealthIndicator implements HealthIndicator {

    private final SynthesisEngine engine;
    private final PlaybackDeviceFactory deviceFactory;
    private final PipelineOrchestrator orchestrator;

    public ReadAloudHealthIndicator(SynthesisEngine engine,
                                    PlaybackDeviceFactory deviceFactory,
                                    PipelineOrchestrator orchestrator) {
        this.engine = engine;
        this.deviceFactory = deviceFactory;
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        boolean engineReady = engine.isHealthy();
        boolean deviceReady = deviceFactory.isAvailable();

        Health.Builder builder = new Health.Builder();
        if (engineReady && deviceReady) {
            builder.up().withDetail("status", "Synthesis and playback operational");
        } else if (engineReady || deviceReady) {
            builder.status("DEGRADED").withDetail("status", engineReady
                    ? "Playback device unavailable" : "Synthesis engine unavailable");
        } else {
            builder.down().withDetail("status", "Neither synthesis nor playback available");
        }
        return builder
                .withDetail("engine", engine.getEngineName() + ": " + (engineReady ? "ready" : "unhealthy"))
                .withDetail("device", deviceFactory.getDeviceName() + ": "
                        + (deviceReady ? "ready" : "unavailable"))
                .withDetail("activeSessions", orchestrator.activeSessions().size())
                .build();
    }
}
