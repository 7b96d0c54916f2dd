package com.phillippitts.readaloud.config.properties;

import com.phillippitts.readaloud.domain.TextChunk;
import com.phillippitts.readaloud.service.segment.ProtectedPatterns;
import com.phillippitts.readaloud.service.segment.Segmenter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkingPropertiesTest {

    private static ChunkingProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bindOrCreate("chunking", ChunkingProperties.class);
    }

    @Test
    void shouldUseBuiltInTableWhenNoPatternsConfigured() {
        // Act
        ChunkingProperties properties = bind(Map.of("chunking.min-size", "10"));

        // Assert
        assertThat(properties.minSize()).isEqualTo(10);
        assertThat(properties.maxSize()).isEqualTo(300);
        assertThat(properties.protectedPatterns()).isEqualTo(ProtectedPatterns.DEFAULT_PATTERNS);
    }

    @Test
    void shouldProtectConfiguredLiteralToken() {
        // Arrange
        ChunkingProperties properties = bind(Map.of(
                "chunking.min-size", "5",
                "chunking.max-size", "40",
                "chunking.protected-patterns[0]", "Co."));
        String text = "Call Acme Co. Today and tomorrow.";

        // Act
        List<TextChunk> chunks = new Segmenter().segment(text, 5, 20,
                ProtectedPatterns.of(properties.protectedPatterns()), 0);

        // Assert
        assertThat(properties.protectedPatterns()).containsExactly("Co.");
        assertThat(chunks).extracting(TextChunk::text)
                .containsExactly("Call Acme Co. Today", "and tomorrow.");
    }
}
