package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.PlaybackState;
import com.phillippitts.readaloud.exception.InvalidStateTransitionException;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe holder of one session's {@link PlaybackState}.
 *
 * <p>Every accepted transition is reported to the listener while the lock is held, so listeners
 * observe transitions in the order they happened. Listeners must not call back into the machine.
 *
 * <p><b>State Transitions:</b> see {@link PlaybackState}. Terminal states are final; once one is
 * reached every further transition is refused.
 *
 * @since 1.0
 */
public final class PlaybackStateMachine {

    /** Receives accepted transitions. */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(PlaybackState previous, PlaybackState current);
    }

    private final Lock lock = new ReentrantLock();
    private final TransitionListener listener;
    private PlaybackState state = PlaybackState.IDLE;

    public PlaybackStateMachine() {
        this((previous, current) -> { });
    }

    public PlaybackStateMachine(TransitionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Moves to {@code target}. Moving to the current state is a no-op.
     *
     * @param target requested state
     * @throws InvalidStateTransitionException if the transition is not allowed
     */
    public void transition(PlaybackState target) {
        Objects.requireNonNull(target, "target must not be null");
        lock.lock();
        try {
            if (state == target) {
                return;
            }
            if (!state.canTransitionTo(target)) {
                throw new InvalidStateTransitionException(state, target);
            }
            apply(target);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to {@code target} only if the current state is one of {@code expected}.
     *
     * @return {@code true} if the transition happened
     */
    public boolean transitionIf(Set<PlaybackState> expected, PlaybackState target) {
        Objects.requireNonNull(target, "target must not be null");
        lock.lock();
        try {
            if (!expected.contains(state) || state == target || !state.canTransitionTo(target)) {
                return false;
            }
            apply(target);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean transitionIf(PlaybackState expected, PlaybackState target) {
        return transitionIf(EnumSet.of(expected), target);
    }

    /**
     * Moves to a terminal state unless one has already been reached.
     *
     * @param terminal COMPLETED, STOPPED or FAILED
     * @return {@code true} if this call ended the session
     */
    public boolean terminate(PlaybackState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            apply(terminal);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public PlaybackState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal() {
        return current().isTerminal();
    }

    private void apply(PlaybackState target) {
        PlaybackState previous = state;
        state = target;
        listener.onTransition(previous, target);
    }
}
