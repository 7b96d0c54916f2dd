package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.exception.PlaybackException;
import com.phillippitts.readaloud.service.process.DefaultProcessFactory;
import com.phillippitts.readaloud.service.process.ProcessFactory;
import com.phillippitts.readaloud.service.process.ProcessSupport;
import com.phillippitts.readaloud.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Plays each artifact by running a command-line player to completion.
 *
 * <p>Players offer only discrete start and stop: pausing kills the player and resuming starts it
 * again from the beginning of the chunk.
 */
public final class ExternalPlayerDevice implements PlaybackDevice {

    private static final Logger LOG = LogManager.getLogger(ExternalPlayerDevice.class);

    public static final String DEVICE_NAME = "process";

    private final PlayerCommand player;
    private final ProcessFactory processFactory;
    private final Duration maxRuntime;

    public ExternalPlayerDevice(PlayerCommand player) {
        this(player, new DefaultProcessFactory(), ProcessTimeouts.PLAYER_MAX_RUNTIME);
    }

    // Package-private for tests
    ExternalPlayerDevice(PlayerCommand player, ProcessFactory processFactory, Duration maxRuntime) {
        this.player = Objects.requireNonNull(player, "player must not be null");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
        this.maxRuntime = Objects.requireNonNull(maxRuntime, "maxRuntime must not be null");
    }

    @Override
    public String getDeviceName() {
        return DEVICE_NAME;
    }

    @Override
    public boolean preservesPositionOnPause() {
        return false;
    }

    @Override
    public Playback open(AudioArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact must not be null");
        if (artifact.audio() == null) {
            throw new PlaybackException("Chunk " + artifact.index() + " has no audio", DEVICE_NAME);
        }
        return new ProcessPlayback(artifact.index(), player.commandFor(artifact.audio()));
    }

    /**
     * One chunk played by successive player processes (one per start or resume).
     */
    final class ProcessPlayback implements Playback {
        private final int index;
        private final List<String> command;
        private final Object lock = new Object();
        private Process process;
        private long startedNanos;
        private boolean paused;
        private boolean stopped;

        ProcessPlayback(int index, List<String> command) {
            this.index = index;
            this.command = command;
        }

        @Override
        public void start() {
            synchronized (lock) {
                launch();
            }
        }

        private void launch() {
            try {
                process = processFactory.start(command, null);
                process.getOutputStream().close();
                startedNanos = System.nanoTime();
                LOG.debug("Started {} for chunk {}", player.executable(), index);
            } catch (IOException e) {
                throw new PlaybackException("Cannot start " + player.executable() + ": " + e.getMessage(),
                        DEVICE_NAME, e);
            }
        }

        @Override
        public void pause() {
            Process toKill;
            synchronized (lock) {
                if (paused || stopped) {
                    return;
                }
                paused = true;
                toKill = process;
                process = null;
                lock.notifyAll();
            }
            ProcessSupport.destroy(toKill);
        }

        @Override
        public void resume() {
            synchronized (lock) {
                if (!paused || stopped) {
                    return;
                }
                paused = false;
                // Restart from the beginning of the chunk
                launch();
                lock.notifyAll();
            }
        }

        @Override
        public void stop() {
            Process toKill;
            synchronized (lock) {
                stopped = true;
                toKill = process;
                process = null;
                lock.notifyAll();
            }
            ProcessSupport.destroy(toKill);
        }

        @Override
        public boolean awaitCompletion(Duration timeout) throws InterruptedException {
            Process running;
            synchronized (lock) {
                if (stopped) {
                    return true;
                }
                if (paused || process == null) {
                    lock.wait(Math.max(1L, timeout.toMillis()));
                    return stopped;
                }
                running = process;
            }
            if (!running.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                checkRuntime(running);
                return false;
            }
            synchronized (lock) {
                if (stopped) {
                    return true;
                }
                if (paused || running != process) {
                    // Killed by pause, or replaced by a resumed run
                    return false;
                }
            }
            int exitCode = running.exitValue();
            if (exitCode != 0) {
                throw new PlaybackException(player.executable() + " exited with code " + exitCode
                        + " on chunk " + index, DEVICE_NAME);
            }
            return true;
        }

        private void checkRuntime(Process running) {
            long elapsedNanos;
            synchronized (lock) {
                if (running != process) {
                    return;
                }
                elapsedNanos = System.nanoTime() - startedNanos;
            }
            if (elapsedNanos > maxRuntime.toNanos()) {
                ProcessSupport.destroy(running);
                throw new PlaybackException(player.executable() + " still running after "
                        + maxRuntime.toSeconds() + "s on chunk " + index, DEVICE_NAME);
            }
        }

        @Override
        public void close() {
            Process toKill;
            synchronized (lock) {
                toKill = process;
                process = null;
                lock.notifyAll();
            }
            ProcessSupport.destroy(toKill);
        }
    }
}
