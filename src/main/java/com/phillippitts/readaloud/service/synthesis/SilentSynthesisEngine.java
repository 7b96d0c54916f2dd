package com.phillippitts.readaloud.service.synthesis;

import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.domain.VoiceParams;
import com.phillippitts.readaloud.exception.SynthesisException;
import com.phillippitts.readaloud.service.audio.AudioDurations;
import com.phillippitts.readaloud.service.audio.WavWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Engine that writes silence sized to the text's speaking-rate estimate.
 *
 * <p>Used for dry runs and environments without a TTS binary. Every chunk yields a valid
 * 16 kHz mono WAV, so the whole pipeline (ordering, buffering, playback) runs as it would with a
 * real engine.
 */
public final class SilentSynthesisEngine extends AbstractSynthesisEngine {

    private static final Logger LOG = LogManager.getLogger(SilentSynthesisEngine.class);

    public static final String ENGINE_NAME = "silent";

    static final int SAMPLE_RATE = 16_000;
    private static final int BYTES_PER_SAMPLE = 2;

    private final Duration maxDuration;

    public SilentSynthesisEngine() {
        this(Duration.ofSeconds(30));
    }

    /**
     * @param maxDuration upper bound on the silence written for one chunk
     */
    public SilentSynthesisEngine(Duration maxDuration) {
        this.maxDuration = Objects.requireNonNull(maxDuration, "maxDuration must not be null");
    }

    @Override
    protected void doInitialize() {
        LOG.info("Silent synthesis engine ready");
    }

    @Override
    protected void doClose() {
        LOG.debug("Silent synthesis engine closed");
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public SynthesisResult synthesize(String text, VoiceParams voice, Path output) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(output, "output must not be null");
        ensureInitialized();

        Duration duration = AudioDurations.estimate(text);
        if (duration.compareTo(maxDuration) > 0) {
            duration = maxDuration;
        }
        int samples = (int) (duration.toMillis() * SAMPLE_RATE / 1000L);
        try {
            WavWriter.writePcm16LeMono(new byte[samples * BYTES_PER_SAMPLE], SAMPLE_RATE, output);
        } catch (IOException e) {
            throw new SynthesisException("Failed to write " + output.getFileName() + ": " + e.getMessage(),
                    ENGINE_NAME, FailureReason.ENGINE_ERROR, e);
        }
        return new SynthesisResult(output, duration);
    }
}
