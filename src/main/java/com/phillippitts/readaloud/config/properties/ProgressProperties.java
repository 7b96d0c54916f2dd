package com.phillippitts.readaloud.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Progress publication settings. Binds to properties prefixed with "progress".
 *
 * @param publishIntervalMs minimum interval between two published progress snapshots
 */
@ConfigurationProperties(prefix = "progress")
@Validated
public record ProgressProperties(
        @DefaultValue("2000")
        @Positive(message = "Publish interval must be positive")
        long publishIntervalMs
) {
}
