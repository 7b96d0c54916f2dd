package com.phillippitts.readaloud.service.health;

import com.phillippitts.readaloud.service.orchestration.PipelineOrchestrator;
import com.phillippitts.readaloud.service.orchestration.StreamingSession;
import com.phillippitts.readaloud.service.playback.PlaybackDeviceFactory;
import com.phillippitts.readaloud.service.synthesis.SynthesisEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReadAloudHealthIndicatorTest {

    private SynthesisEngine engine;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        engine = mock(SynthesisEngine.class);
        orchestrator = mock(PipelineOrchestrator.class);
        when(engine.getEngineName()).thenReturn("process");
        when(orchestrator.activeSessions()).thenReturn(List.of());
    }

    @Test
    void shouldReportUpWhenEngineAndDeviceReady() {
        when(engine.isHealthy()).thenReturn(true);
        when(orchestrator.activeSessions()).thenReturn(List.of(mock(StreamingSession.class)));

        Health health = indicator(true).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Synthesis and playback operational");
        assertThat(health.getDetails()).containsEntry("engine", "process: ready");
        assertThat(health.getDetails()).containsEntry("device", "file: ready");
        assertThat(health.getDetails()).containsEntry("activeSessions", 1);
    }

    @Test
    void shouldReportDegradedWhenEngineUnhealthy() {
        when(engine.isHealthy()).thenReturn(false);

        Health health = indicator(true).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Synthesis engine unavailable");
        assertThat(health.getDetails()).containsEntry("engine", "process: unhealthy");
    }

    @Test
    void shouldReportDegradedWhenDeviceUnavailable() {
        when(engine.isHealthy()).thenReturn(true);

        Health health = indicator(false).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Playback device unavailable");
        assertThat(health.getDetails()).containsEntry("device", "file: unavailable");
    }

    @Test
    void shouldReportDownWhenNothingAvailable() {
        when(engine.isHealthy()).thenReturn(false);

        Health health = indicator(false).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("activeSessions", 0);
    }

    private ReadAloudHealthIndicator indicator(boolean deviceAvailable) {
        PlaybackDeviceFactory factory = new PlaybackDeviceFactory("file", () -> deviceAvailable, sessionId -> {
            throw new UnsupportedOperationException("not used");
        });
        return new ReadAloudHealthIndicator(engine, factory, orchestrator);
    }
}
