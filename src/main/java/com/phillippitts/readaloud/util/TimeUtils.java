package com.phillippitts.readaloud.util;

import java.time.Duration;

/**
 * Utility methods for elapsed-time calculations based on {@link System#nanoTime()}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Elapsed time since a nanosecond timestamp as a {@link Duration}.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed duration, never negative
     */
    public static Duration elapsed(long startNanos) {
        return Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
    }

    /**
     * Formats a duration as seconds with one decimal, e.g. {@code 1.5s}, for log lines.
     *
     * @param duration duration to format; {@code null} renders as {@code n/a}
     * @return formatted duration
     */
    public static String formatSeconds(Duration duration) {
        if (duration == null) {
            return "n/a";
        }
        return String.format(java.util.Locale.ROOT, "%.1fs", duration.toMillis() / 1000.0);
    }
}
