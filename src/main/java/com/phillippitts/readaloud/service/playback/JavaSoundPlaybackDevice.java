package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.exception.PlaybackException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.Line;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plays artifacts through a Java Sound {@link Clip}, with true position-preserving pause.
 */
public final class JavaSoundPlaybackDevice implements PlaybackDevice {

    private static final Logger LOG = LogManager.getLogger(JavaSoundPlaybackDevice.class);

    public static final String DEVICE_NAME = "javasound";

    /** Abstraction to obtain an opened Clip (for testing). */
    @FunctionalInterface
    public interface ClipProvider {
        Clip open(AudioInputStream stream) throws LineUnavailableException, IOException;
    }

    private final ClipProvider provider;

    public JavaSoundPlaybackDevice() {
        this(defaultProvider());
    }

    // Package-private for tests
    JavaSoundPlaybackDevice(ClipProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    private static ClipProvider defaultProvider() {
        return stream -> {
            Clip clip = AudioSystem.getClip();
            clip.open(stream);
            return clip;
        };
    }

    /**
     * @return {@code true} if the default mixer offers a Clip line
     */
    public static boolean isSupported() {
        try {
            return AudioSystem.isLineSupported(new Line.Info(Clip.class));
        } catch (RuntimeException e) {
            LOG.debug("Java Sound probe failed: {}", e.toString());
            return false;
        }
    }

    @Override
    public String getDeviceName() {
        return DEVICE_NAME;
    }

    @Override
    public Playback open(AudioArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact must not be null");
        try (AudioInputStream stream = AudioSystem.getAudioInputStream(artifact.audio().toFile())) {
            return new ClipPlayback(provider.open(stream));
        } catch (UnsupportedAudioFileException | IOException | LineUnavailableException
                 | IllegalArgumentException | SecurityException e) {
            throw new PlaybackException("Cannot open chunk " + artifact.index() + ": " + e.getMessage(),
                    DEVICE_NAME, e);
        }
    }

    /**
     * Clip-backed playback. A STOP event that is not caused by {@link #pause()} marks completion.
     *
     * <p>Java Sound delivers STOP events asynchronously, so the event of a pause may arrive after
     * {@link #resume()}. Each pause of a running clip is counted and its STOP event is consumed
     * by that count, never taken as the end of the clip.
     */
    static final class ClipPlayback implements Playback {
        private final Clip clip;
        private final CountDownLatch finished = new CountDownLatch(1);
        private final AtomicInteger pendingPauseStops = new AtomicInteger();
        private volatile boolean paused;
        private volatile boolean closed;

        ClipPlayback(Clip clip) {
            this.clip = clip;
            clip.addLineListener(event -> {
                if (event.getType() != LineEvent.Type.STOP) {
                    return;
                }
                if (pendingPauseStops.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
                    return;
                }
                if (!paused) {
                    finished.countDown();
                }
            });
        }

        @Override
        public void start() {
            clip.start();
        }

        @Override
        public void pause() {
            if (clip.isRunning()) {
                pendingPauseStops.incrementAndGet();
            }
            paused = true;
            clip.stop();
        }

        @Override
        public void resume() {
            paused = false;
            if (clip.getFramePosition() >= clip.getFrameLength()) {
                finished.countDown();
                return;
            }
            clip.start();
        }

        @Override
        public void stop() {
            paused = false;
            finished.countDown();
            clip.stop();
        }

        @Override
        public boolean awaitCompletion(Duration timeout) throws InterruptedException {
            return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            finished.countDown();
            clip.close();
        }
    }
}
