package com.phillippitts.readaloud.config.pipeline;

import com.phillippitts.readaloud.config.properties.ChunkingProperties;
import com.phillippitts.readaloud.config.properties.FeederProperties;
import com.phillippitts.readaloud.config.properties.PlaybackProperties;
import com.phillippitts.readaloud.config.properties.ProgressProperties;
import com.phillippitts.readaloud.config.properties.SynthesisProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the configured defaults as one {@link PipelineSettings} bean. Sessions started over
 * HTTP derive their settings from it.
 */
@Configuration
public class PipelineConfig {

    private static final Logger LOG = LogManager.getLogger(PipelineConfig.class);

    @Bean
    public PipelineSettings pipelineSettings(ChunkingProperties chunking,
                                             FeederProperties feeder,
                                             SynthesisProperties synthesis,
                                             PlaybackProperties playback,
                                             ProgressProperties progress) {
        PipelineSettings settings = PipelineSettings.from(chunking, feeder, synthesis, playback, progress);
        LOG.info("Pipeline settings: chunks=[{}, {}], workers={}, timeout={}ms, buffer={} (low={}, high={})",
                settings.minChunkSize(), settings.maxChunkSize(), settings.workers(),
                settings.synthesisTimeout().toMillis(), settings.playbackCapacity(),
                settings.lowWatermark(), settings.highWatermark());
        return settings;
    }
}
