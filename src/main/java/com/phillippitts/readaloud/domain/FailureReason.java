package com.phillippitts.readaloud.domain;

import java.util.Locale;

/**
 * Why a chunk produced no playable audio.
 */
public enum FailureReason {
    /** The synthesis call exceeded its per-chunk timeout. */
    TIMEOUT,
    /** The engine reported an error or could not be invoked. */
    ENGINE_ERROR,
    /** The engine returned without producing usable audio. */
    EMPTY_AUDIO,
    /** The session was cancelled while the chunk was in flight. */
    CANCELLED;

    /**
     * @return lower-case label used in events and metric tags, e.g. {@code timeout}
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
