package com.phillippitts.readaloud.exception;

/**
 * Thrown when input defeats the chunk size band (for example a single word longer than the
 * maximum chunk size). The segmenter recovers locally by giving the long word a chunk of its own.
 */
public class SegmentationException extends ReadAloudException {

    private final int offset;

    public SegmentationException(String message, int offset) {
        super(message + " (offset: " + offset + ")");
        this.offset = offset;
    }

    /**
     * @return character offset in the normalized text where segmentation gave up
     */
    public int getOffset() {
        return offset;
    }
}
