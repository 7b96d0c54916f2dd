package com.phillippitts.readaloud.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Content feeder tuning. Binds to properties prefixed with "feeder".
 *
 * @param segmentThresholdChars buffered characters that trigger a segmentation pass
 * @param readBufferChars characters requested per read from a reader-backed source
 * @param workQueueCapacity chunks the feeder may run ahead of the synthesis workers
 * @param maxChars cap on characters taken from a source; 0 disables the cap
 */
@ConfigurationProperties(prefix = "feeder")
@Validated
public record FeederProperties(
        @DefaultValue("4096")
        @Positive(message = "Segment threshold must be positive")
        int segmentThresholdChars,

        @DefaultValue("1024")
        @Positive(message = "Read buffer must be positive")
        int readBufferChars,

        @DefaultValue("8")
        @Positive(message = "Work queue capacity must be positive")
        int workQueueCapacity,

        @DefaultValue("0")
        @Min(value = 0, message = "Max chars must be zero (unlimited) or positive")
        int maxChars
) {
}
