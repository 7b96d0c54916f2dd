package com.phillippitts.readaloud.service.buffer;

import com.phillippitts.readaloud.domain.AudioArtifact;

/**
 * Destination of artifacts released in index order by the {@link ReorderBuffer}.
 */
@FunctionalInterface
public interface ArtifactSink {

    /**
     * Takes ownership of the next artifact, blocking while the sink is full.
     *
     * @param artifact next artifact in index order
     * @throws InterruptedException if interrupted while waiting for space
     * @throws java.util.concurrent.CancellationException if the session is cancelled
     */
    void accept(AudioArtifact artifact) throws InterruptedException;
}
