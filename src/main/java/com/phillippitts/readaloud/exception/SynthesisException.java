package com.phillippitts.readaloud.exception;

import com.phillippitts.readaloud.domain.FailureReason;

/**
 * Thrown when a synthesis call fails, including timeouts.
 * Per-chunk: the chunk is marked failed and the session continues.
 */
public class SynthesisException extends ReadAloudException {

    private final String engineName;
    private final FailureReason reason;

    public SynthesisException(String message, String engineName) {
        this(message, engineName, FailureReason.ENGINE_ERROR);
    }

    public SynthesisException(String message, String engineName, FailureReason reason) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
        this.reason = reason;
    }

    public SynthesisException(String message, String engineName, FailureReason reason, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
        this.reason = reason;
    }

    public String getEngineName() {
        return engineName;
    }

    public FailureReason getReason() {
        return reason;
    }
}
