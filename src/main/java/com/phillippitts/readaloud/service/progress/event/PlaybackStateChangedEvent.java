package com.phillippitts.readaloud.service.progress.event;

import com.phillippitts.readaloud.domain.PlaybackState;

import java.time.Instant;
import java.util.Objects;

/**
 * Emitted on every session state transition.
 *
 * @param sessionId session whose state changed
 * @param previous  state before the transition
 * @param current   state after the transition
 * @param timestamp when the transition happened
 */
public record PlaybackStateChangedEvent(
        String sessionId,
        PlaybackState previous,
        PlaybackState current,
        Instant timestamp
) {
    public PlaybackStateChangedEvent {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(previous, "previous must not be null");
        Objects.requireNonNull(current, "current must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
