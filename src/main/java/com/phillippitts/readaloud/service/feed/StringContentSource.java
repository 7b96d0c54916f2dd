package com.phillippitts.readaloud.service.feed;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Source over text already held in memory, handed out in fixed-size pieces.
 */
public final class StringContentSource implements ContentSource {

    private final String sourceId;
    private final String text;
    private final int pieceSize;
    private int position;

    public StringContentSource(String sourceId, String text, int pieceSize) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        if (pieceSize <= 0) {
            throw new IllegalArgumentException("pieceSize must be positive, got: " + pieceSize);
        }
        this.pieceSize = pieceSize;
    }

    public StringContentSource(String sourceId, String text) {
        this(sourceId, text, 1024);
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public synchronized Optional<String> read() {
        if (position >= text.length()) {
            return Optional.empty();
        }
        int end = Math.min(text.length(), position + pieceSize);
        String piece = text.substring(position, end);
        position = end;
        return Optional.of(piece);
    }

    @Override
    public OptionalLong estimatedLength() {
        return OptionalLong.of(text.length());
    }
}
