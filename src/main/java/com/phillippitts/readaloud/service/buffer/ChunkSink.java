package com.phillippitts.readaloud.service.buffer;

import com.phillippitts.readaloud.domain.TextChunk;

/**
 * Ordered destination of the chunks emitted by the feeder.
 */
@FunctionalInterface
public interface ChunkSink {

    /**
     * Accepts the next chunk, blocking while the sink is full.
     *
     * @param chunk chunk with the next index
     * @throws InterruptedException if interrupted while waiting for space
     * @throws java.util.concurrent.CancellationException if the session is cancelled
     */
    void accept(TextChunk chunk) throws InterruptedException;
}
