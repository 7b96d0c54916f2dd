package com.phillippitts.readaloud.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and thread management.
 *
 * <p>Used by the subprocess synthesis engine and the external player device.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort; they are daemon threads).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Upper bound on a single external player run. Chunks are seconds long; a player still running
     * after this is considered hung and reported as a playback failure.
     */
    public static final Duration PLAYER_MAX_RUNTIME = Duration.ofMinutes(5);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
