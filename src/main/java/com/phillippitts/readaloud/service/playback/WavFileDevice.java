package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.exception.PlaybackException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;

/**
 * "Plays" artifacts by appending their audio to a single WAV file, in playback order.
 *
 * <p>The first artifact fixes the output format; later artifacts are converted to it when Java
 * Sound can do so. PCM data is collected in a side file and wrapped into the final WAV on
 * {@link #close()}. Useful for headless machines and for listening to a session afterwards.
 */
public final class WavFileDevice implements PlaybackDevice {

    private static final Logger LOG = LogManager.getLogger(WavFileDevice.class);

    public static final String DEVICE_NAME = "file";

    private final Path output;
    private final Path pcmPart;
    private final Object lock = new Object();
    private AudioFormat format;
    private long frames;
    private boolean closed;

    public WavFileDevice(Path output) {
        this.output = Objects.requireNonNull(output, "output must not be null").toAbsolutePath();
        this.pcmPart = this.output.resolveSibling(this.output.getFileName() + ".part");
    }

    @Override
    public String getDeviceName() {
        return DEVICE_NAME;
    }

    @Override
    public Playback open(AudioArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact must not be null");
        if (artifact.audio() == null) {
            throw new PlaybackException("Chunk " + artifact.index() + " has no audio", DEVICE_NAME);
        }
        return new AppendPlayback(artifact);
    }

    public Path output() {
        return output;
    }

    /**
     * @return frames appended so far
     */
    public long framesWritten() {
        synchronized (lock) {
            return frames;
        }
    }

    private void append(AudioArtifact artifact) {
        synchronized (lock) {
            if (closed) {
                throw new PlaybackException("Device already closed", DEVICE_NAME);
            }
            try (AudioInputStream source = AudioSystem.getAudioInputStream(artifact.audio().toFile());
                 AudioInputStream converted = toOutputFormat(source);
                 OutputStream out = Files.newOutputStream(pcmPart, StandardOpenOption.CREATE,
                         StandardOpenOption.APPEND)) {
                long bytes = converted.transferTo(out);
                frames += bytes / format.getFrameSize();
            } catch (UnsupportedAudioFileException | IOException | IllegalArgumentException e) {
                throw new PlaybackException("Cannot append chunk " + artifact.index() + ": " + e.getMessage(),
                        DEVICE_NAME, e);
            }
        }
    }

    private AudioInputStream toOutputFormat(AudioInputStream source) {
        if (format == null) {
            format = source.getFormat();
            return source;
        }
        if (source.getFormat().matches(format)) {
            return source;
        }
        return AudioSystem.getAudioInputStream(format, source);
    }

    /**
     * Writes the collected audio as a WAV file. Idempotent; writes nothing if no chunk was played.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (format == null || !Files.exists(pcmPart)) {
                LOG.info("No audio played; {} not written", output.getFileName());
                return;
            }
            try (InputStream pcm = new BufferedInputStream(Files.newInputStream(pcmPart));
                 AudioInputStream stream = new AudioInputStream(pcm, format, frames)) {
                AudioSystem.write(stream, AudioFileFormat.Type.WAVE, output.toFile());
                LOG.info("Wrote {} frames to {}", frames, output);
            } catch (IOException e) {
                throw new PlaybackException("Cannot write " + output + ": " + e.getMessage(), DEVICE_NAME, e);
            } finally {
                deletePart();
            }
        }
    }

    private void deletePart() {
        try {
            Files.deleteIfExists(pcmPart);
        } catch (IOException e) {
            LOG.warn("Failed to delete {}: {}", pcmPart.getFileName(), e.toString());
        }
    }

    /**
     * Appends on start; completes immediately.
     */
    private final class AppendPlayback implements Playback {
        private final AudioArtifact artifact;
        private volatile boolean done;

        AppendPlayback(AudioArtifact artifact) {
            this.artifact = artifact;
        }

        @Override
        public void start() {
            append(artifact);
            done = true;
        }

        @Override
        public void pause() {
            // Appending is instantaneous; nothing to pause
        }

        @Override
        public void resume() {
            // See pause()
        }

        @Override
        public void stop() {
            done = true;
        }

        @Override
        public boolean awaitCompletion(Duration timeout) {
            return done;
        }

        @Override
        public void close() {
            // Audio already appended
        }
    }
}
