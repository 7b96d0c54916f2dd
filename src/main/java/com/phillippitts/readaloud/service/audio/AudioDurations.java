package com.phillippitts.readaloud.service.audio;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Playing-time estimates for synthesized audio.
 *
 * <p>The WAV header is authoritative when it can be read; otherwise the estimate falls back to a
 * fixed speaking rate over the chunk text.
 */
public final class AudioDurations {

    private static final Logger LOG = LogManager.getLogger(AudioDurations.class);

    /** Average speaking rate used when the audio header gives no answer. */
    public static final int CHARS_PER_SECOND = 15;

    private AudioDurations() {}

    /**
     * @param audio synthesized audio file
     * @param text  text the audio was synthesized from
     * @return duration read from the file, or a speaking-rate estimate
     */
    public static Duration of(Path audio, String text) {
        try {
            AudioFileFormat format = AudioSystem.getAudioFileFormat(audio.toFile());
            long frames = format.getFrameLength();
            float frameRate = format.getFormat().getFrameRate();
            if (frames > 0 && frameRate > 0) {
                return Duration.ofNanos((long) (frames / (double) frameRate * 1_000_000_000L));
            }
        } catch (UnsupportedAudioFileException | IOException e) {
            LOG.debug("Cannot read audio header of {}: {}", audio.getFileName(), e.toString());
        }
        return estimate(text);
    }

    /**
     * @param text chunk text
     * @return speaking-rate estimate, at least one millisecond for non-empty text
     */
    public static Duration estimate(String text) {
        if (text == null || text.isEmpty()) {
            return Duration.ZERO;
        }
        long millis = Math.max(1L, text.length() * 1000L / CHARS_PER_SECOND);
        return Duration.ofMillis(millis);
    }
}
