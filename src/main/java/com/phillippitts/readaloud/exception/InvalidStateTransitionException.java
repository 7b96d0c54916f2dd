package com.phillippitts.readaloud.exception;

import com.phillippitts.readaloud.domain.PlaybackState;

/**
 * Thrown when a command would move a session through a transition its state machine forbids.
 */
public class InvalidStateTransitionException extends ReadAloudException {

    private final PlaybackState from;
    private final PlaybackState to;

    public InvalidStateTransitionException(PlaybackState from, PlaybackState to) {
        super("Cannot transition from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public PlaybackState getFrom() {
        return from;
    }

    public PlaybackState getTo() {
        return to;
    }
}
