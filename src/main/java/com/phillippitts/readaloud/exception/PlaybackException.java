package com.phillippitts.readaloud.exception;

/**
 * Thrown when the playback device fails to open or play an artifact.
 */
public class PlaybackException extends ReadAloudException {

    private final String deviceName;

    public PlaybackException(String message, String deviceName) {
        super(message + " (device: " + deviceName + ")");
        this.deviceName = deviceName;
    }

    public PlaybackException(String message, String deviceName, Throwable cause) {
        super(message + " (device: " + deviceName + ")", cause);
        this.deviceName = deviceName;
    }

    public String getDeviceName() {
        return deviceName;
    }
}
