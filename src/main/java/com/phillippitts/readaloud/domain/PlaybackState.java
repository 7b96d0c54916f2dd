package com.phillippitts.readaloud.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a streaming session.
 *
 * <pre>
 * IDLE → FETCHING → BUFFERING ⇄ PLAYING ⇄ PAUSED
 *                 any non-terminal → COMPLETED | STOPPED | FAILED
 * </pre>
 *
 * {@code BUFFERING} is entered whenever the controller has to wait for the playback buffer to
 * reach its low watermark.
 */
public enum PlaybackState {
    IDLE,
    FETCHING,
    BUFFERING,
    PLAYING,
    PAUSED,
    COMPLETED,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED || this == FAILED;
    }

    /**
     * @param target requested next state
     * @return whether the state machine allows moving from this state to {@code target}
     */
    public boolean canTransitionTo(PlaybackState target) {
        return successors().contains(target);
    }

    private Set<PlaybackState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(FETCHING, COMPLETED, STOPPED, FAILED);
            case FETCHING -> EnumSet.of(BUFFERING, PLAYING, PAUSED, COMPLETED, STOPPED, FAILED);
            case BUFFERING -> EnumSet.of(PLAYING, PAUSED, COMPLETED, STOPPED, FAILED);
            case PLAYING -> EnumSet.of(BUFFERING, PAUSED, COMPLETED, STOPPED, FAILED);
            case PAUSED -> EnumSet.of(PLAYING, BUFFERING, COMPLETED, STOPPED, FAILED);
            case COMPLETED, STOPPED, FAILED -> EnumSet.noneOf(PlaybackState.class);
        };
    }
}
