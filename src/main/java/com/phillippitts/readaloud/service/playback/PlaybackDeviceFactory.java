package com.phillippitts.readaloud.service.playback;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Creates one {@link PlaybackDevice} per session and reports whether the configured device can
 * be used on this machine.
 */
public final class PlaybackDeviceFactory {

    private final String deviceName;
    private final BooleanSupplier availability;
    private final Function<String, PlaybackDevice> creator;

    /**
     * @param deviceName   name reported in health checks and errors
     * @param availability probe telling whether the device can play on this machine
     * @param creator      builds a device for a session id
     */
    public PlaybackDeviceFactory(String deviceName, BooleanSupplier availability,
                                 Function<String, PlaybackDevice> creator) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName must not be null");
        this.availability = Objects.requireNonNull(availability, "availability must not be null");
        this.creator = Objects.requireNonNull(creator, "creator must not be null");
    }

    /**
     * Factory always handing out the same device; for tests and embedded use.
     */
    public static PlaybackDeviceFactory of(PlaybackDevice device) {
        Objects.requireNonNull(device, "device must not be null");
        return new PlaybackDeviceFactory(device.getDeviceName(), () -> true, sessionId -> device);
    }

    public PlaybackDevice create(String sessionId) {
        return creator.apply(sessionId);
    }

    public String getDeviceName() {
        return deviceName;
    }

    public boolean isAvailable() {
        return availability.getAsBoolean();
    }
}
