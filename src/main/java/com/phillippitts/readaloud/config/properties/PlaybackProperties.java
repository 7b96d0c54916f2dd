package com.phillippitts.readaloud.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Playback buffer watermarks and device selection. Binds to properties prefixed with "playback".
 *
 * @param capacity maximum artifacts held by the playback buffer
 * @param lowWatermark artifacts the controller waits for before (re)starting playback
 * @param highWatermark combined reorder + playback occupancy at which workers stop pulling chunks
 * @param device device selector: {@code javasound}, {@code process} or {@code file}
 * @param player external player for the {@code process} device, or {@code auto}
 * @param outputPath WAV file written by the {@code file} device
 */
@ConfigurationProperties(prefix = "playback")
@Validated
public record PlaybackProperties(
        @DefaultValue("5")
        @Positive(message = "Playback buffer capacity must be positive")
        int capacity,

        @DefaultValue("2")
        @Positive(message = "Low watermark must be positive")
        int lowWatermark,

        @DefaultValue("4")
        @Positive(message = "High watermark must be positive")
        int highWatermark,

        @DefaultValue("javasound")
        @NotBlank(message = "Playback device must not be blank")
        String device,

        @DefaultValue("auto")
        @NotBlank(message = "Player must not be blank")
        String player,

        @DefaultValue("readaloud-output.wav")
        @NotBlank(message = "Output path must not be blank")
        String outputPath
) {
    @AssertTrue(message = "playback watermarks must satisfy low <= high and low <= capacity")
    public boolean isWatermarksValid() {
        return lowWatermark <= highWatermark && lowWatermark <= capacity;
    }
}
