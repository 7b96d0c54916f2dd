package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.exception.PlaybackException;

import java.time.Duration;

/**
 * Playback of a single artifact on a device.
 *
 * <p>Obtained from {@link PlaybackDevice#open}; nothing is audible before {@link #start()}.
 * {@link #pause()}, {@link #resume()} and {@link #stop()} may be called from any thread.
 */
public interface Playback extends AutoCloseable {

    /**
     * @throws PlaybackException if the device cannot start playing
     */
    void start();

    /**
     * Halts output. Devices without position-preserving pause restart the artifact from its
     * beginning on {@link #resume()}.
     */
    void pause();

    void resume();

    /**
     * Ends the playback for good; {@link #awaitCompletion(Duration)} returns {@code true} afterwards.
     */
    void stop();

    /**
     * Waits for the artifact to finish playing. A paused playback is not finished.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if playback finished or was stopped, {@code false} on timeout
     * @throws InterruptedException if interrupted while waiting
     * @throws PlaybackException if the device failed while playing
     */
    boolean awaitCompletion(Duration timeout) throws InterruptedException;

    /**
     * Releases device resources. Idempotent.
     */
    @Override
    void close();
}
