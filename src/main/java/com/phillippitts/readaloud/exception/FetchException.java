package com.phillippitts.readaloud.exception;

/**
 * Thrown when a content source fails irrecoverably while being read.
 * Chunks emitted before the failure continue downstream.
 */
public class FetchException extends ReadAloudException {

    private final String sourceId;

    public FetchException(String message, String sourceId, Throwable cause) {
        super(message + " (source: " + sourceId + ")", cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
