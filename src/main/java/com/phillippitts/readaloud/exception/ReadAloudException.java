package com.phillippitts.readaloud.exception;

/**
 * Base exception for all readAloud application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class ReadAloudException extends RuntimeException {

    public ReadAloudException(String message) {
        super(message);
    }

    public ReadAloudException(String message, Throwable cause) {
        super(message, cause);
    }

    public ReadAloudException(Throwable cause) {
        super(cause);
    }
}
