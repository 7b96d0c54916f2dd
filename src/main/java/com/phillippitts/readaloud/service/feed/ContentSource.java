package com.phillippitts.readaloud.service.feed;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Incremental text producer read by the {@link ContentFeeder}.
 *
 * <p>Acquisition and parsing (HTML, PDF, network) happen outside this interface; a source only
 * hands out successive pieces of plain text. Pieces may end in the middle of a word or sentence.
 */
public interface ContentSource extends AutoCloseable {

    /**
     * @return identifier of the source for logs and session metadata (URL, file name, "stdin")
     */
    String sourceId();

    /**
     * Reads the next piece of text, blocking until one is available.
     *
     * @return next piece, or empty once the source is exhausted
     * @throws IOException on an irrecoverable read failure
     */
    Optional<String> read() throws IOException;

    /**
     * @return total length in characters if known up front, used for early chunk estimates
     */
    default OptionalLong estimatedLength() {
        return OptionalLong.empty();
    }

    /**
     * Releases the underlying resource. Closing may unblock a pending {@link #read()}.
     */
    @Override
    default void close() throws IOException {
    }
}
