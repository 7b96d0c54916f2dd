package com.phillippitts.readaloud.domain;

import java.util.Objects;

/**
 * Immutable span of source text destined for one synthesis call.
 *
 * @param index position of the chunk in its session; assigned once by the feeder, never reused
 * @param text  chunk text (never empty)
 */
public record TextChunk(int index, String text) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if index is negative or text is blank
     * @throws NullPointerException if text is null
     */
    public TextChunk {
        if (index < 0) {
            throw new IllegalArgumentException("Chunk index must not be negative, got: " + index);
        }
        Objects.requireNonNull(text, "Chunk text must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Chunk text must not be blank");
        }
    }

    public int charCount() {
        return text.length();
    }
}
