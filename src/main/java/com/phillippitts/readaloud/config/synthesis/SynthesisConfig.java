package com.phillippitts.readaloud.config.synthesis;

import com.phillippitts.readaloud.config.properties.SynthesisProperties;
import com.phillippitts.readaloud.exception.SynthesisException;
import com.phillippitts.readaloud.service.synthesis.ProcessSynthesisEngine;
import com.phillippitts.readaloud.service.synthesis.SilentSynthesisEngine;
import com.phillippitts.readaloud.service.synthesis.SynthesisEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the synthesis engine from {@code synthesis.engine}.
 *
 * <p>An engine that fails to initialize (for example a missing TTS binary) is still registered:
 * it reports itself unhealthy, chunks fail individually, and the health endpoint shows why.
 */
@Configuration
public class SynthesisConfig {

    private static final Logger LOG = LogManager.getLogger(SynthesisConfig.class);

    /**
     * Subprocess engine. Active when synthesis.engine is "process" or missing.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "synthesis", name = "engine", havingValue = "process", matchIfMissing = true)
    public SynthesisEngine processSynthesisEngine(SynthesisProperties properties) {
        return initialized(new ProcessSynthesisEngine(properties.process()));
    }

    /**
     * Silence-writing engine. Active when synthesis.engine=silent.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "synthesis", name = "engine", havingValue = "silent")
    public SynthesisEngine silentSynthesisEngine() {
        return initialized(new SilentSynthesisEngine());
    }

    private static SynthesisEngine initialized(SynthesisEngine engine) {
        try {
            engine.initialize();
        } catch (SynthesisException e) {
            LOG.warn("Synthesis engine '{}' unavailable: {}", engine.getEngineName(), e.getMessage());
        }
        return engine;
    }
}
