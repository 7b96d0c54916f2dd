package com.phillippitts.readaloud.service.progress.event;

import com.phillippitts.readaloud.domain.FailureReason;

import java.time.Instant;
import java.util.Objects;

/**
 * Emitted for every chunk that produced no playable audio. Playback continues with the next chunk.
 *
 * @param sessionId session the chunk belongs to
 * @param index     chunk index
 * @param reason    failure category
 * @param detail    human-readable detail (never contains chunk text)
 * @param timestamp when the failure was recorded
 */
public record ChunkFailedEvent(
        String sessionId,
        int index,
        FailureReason reason,
        String detail,
        Instant timestamp
) {
    public ChunkFailedEvent {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        detail = detail == null ? "" : detail;
    }
}
