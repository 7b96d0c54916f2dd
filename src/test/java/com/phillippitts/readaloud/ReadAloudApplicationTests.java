package com.phillippitts.readaloud;

import com.phillippitts.readaloud.config.pipeline.PipelineSettings;
import com.phillippitts.readaloud.service.playback.PlaybackDeviceFactory;
import com.phillippitts.readaloud.service.synthesis.SynthesisEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ReadAloudApplicationTests {

    @Autowired
    private SynthesisEngine engine;

    @Autowired
    private PlaybackDeviceFactory deviceFactory;

    @Autowired
    private PipelineSettings settings;

    @Test
    void contextLoads() {
        assertThat(engine.getEngineName()).isEqualTo("silent");
        assertThat(engine.isHealthy()).isTrue();
        assertThat(deviceFactory.getDeviceName()).isEqualTo("file");
        assertThat(settings.workers()).isEqualTo(2);
        assertThat(settings.synthesisTimeout().toMillis()).isEqualTo(5000);
    }
}
