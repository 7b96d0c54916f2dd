package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.exception.PlaybackException;

/**
 * Audio output used by one session's playback controller.
 *
 * <p>Devices are created per session by a {@link PlaybackDeviceFactory} and closed when the
 * session ends.
 */
public interface PlaybackDevice extends AutoCloseable {

    String getDeviceName();

    /**
     * Prepares an artifact for playback without starting it. Opening ahead of time keeps the gap
     * between consecutive chunks short.
     *
     * @param artifact ready artifact
     * @return prepared playback
     * @throws PlaybackException if the artifact cannot be opened
     */
    Playback open(AudioArtifact artifact);

    /**
     * @return {@code true} if pause keeps the position, {@code false} if a paused chunk restarts
     */
    default boolean preservesPositionOnPause() {
        return true;
    }

    @Override
    default void close() {
    }
}
