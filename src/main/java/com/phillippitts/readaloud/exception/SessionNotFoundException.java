package com.phillippitts.readaloud.exception;

/**
 * Thrown when a command addresses a session that does not exist or has already terminated.
 */
public class SessionNotFoundException extends ReadAloudException {

    public SessionNotFoundException(String sessionId) {
        super("No active session: " + sessionId);
    }
}
