package com.phillippitts.readaloud.config.properties;

import com.phillippitts.readaloud.service.segment.ProtectedPatterns;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Chunk size band and protected-token table used by the segmenter.
 * Binds to properties prefixed with "chunking".
 *
 * <p>Example application.properties:
 * <pre>
 * chunking.min-size=40
 * chunking.max-size=300
 * chunking.protected-patterns=Dr.,Mr.,U.S.,P.M.
 * </pre>
 *
 * @param minSize smallest chunk (in characters) the segmenter closes on its own
 * @param maxSize largest chunk (in characters) the segmenter emits for splittable text
 * @param protectedPatterns tokens inside which no sentence boundary is recognized;
 *                          empty means {@link ProtectedPatterns#DEFAULT_PATTERNS}
 */
@ConfigurationProperties(prefix = "chunking")
@Validated
public record ChunkingProperties(
        @DefaultValue("40")
        @Positive(message = "Minimum chunk size must be positive")
        int minSize,

        @DefaultValue("300")
        @Positive(message = "Maximum chunk size must be positive")
        int maxSize,

        List<String> protectedPatterns
) {
    public ChunkingProperties {
        protectedPatterns = (protectedPatterns == null || protectedPatterns.isEmpty())
                ? ProtectedPatterns.DEFAULT_PATTERNS
                : List.copyOf(protectedPatterns);
    }

    @AssertTrue(message = "chunking.min-size must not exceed chunking.max-size")
    public boolean isSizeBandValid() {
        return minSize <= maxSize;
    }
}
