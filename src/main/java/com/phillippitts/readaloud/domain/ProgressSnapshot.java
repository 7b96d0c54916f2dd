package com.phillippitts.readaloud.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time view of a session's progress. Recomputed for every publication, never mutated.
 *
 * @param sessionId           session this snapshot belongs to
 * @param state               session state when the snapshot was taken
 * @param chunksFetched       chunks emitted by the feeder
 * @param chunksSynthesized   chunks whose synthesis produced audio
 * @param chunksFailed        chunks that failed synthesis and were skipped
 * @param chunksPlayed        artifacts whose playback started; never decreases
 * @param bufferedCount       artifacts waiting in the playback buffer
 * @param totalChunksEstimate best-effort total chunk count, 0 when unknown
 * @param estimatedRemaining  estimated playing time left
 * @param truncated           whether the source ended early (fetch error or character cap)
 * @param timeToFirstAudio    delay from start to first playback, {@code null} before it happens
 * @param timestamp           when the snapshot was taken
 */
public record ProgressSnapshot(
        String sessionId,
        PlaybackState state,
        int chunksFetched,
        int chunksSynthesized,
        int chunksFailed,
        int chunksPlayed,
        int bufferedCount,
        int totalChunksEstimate,
        Duration estimatedRemaining,
        boolean truncated,
        Duration timeToFirstAudio,
        Instant timestamp
) {

    public ProgressSnapshot {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(estimatedRemaining, "estimatedRemaining must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /**
     * @return played share of the estimated total, 0-100; 0 while the total is unknown
     */
    public int percentComplete() {
        if (totalChunksEstimate <= 0) {
            return 0;
        }
        int done = chunksPlayed + chunksFailed;
        return Math.min(100, (int) Math.round(100.0 * done / totalChunksEstimate));
    }
}
