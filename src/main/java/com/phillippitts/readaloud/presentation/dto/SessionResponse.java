package com.phillippitts.readaloud.presentation.dto;

import com.phillippitts.readaloud.domain.PlaybackState;
import com.phillippitts.readaloud.domain.ProgressSnapshot;
import com.phillippitts.readaloud.service.orchestration.StreamingSession;

import java.time.Duration;
import java.time.Instant;

/**
 * Session status returned by the sessions API. Durations are in milliseconds; absent values
 * are {@code null}.
 */
public record SessionResponse(
        String id,
        String sourceId,
        PlaybackState state,
        boolean paused,
        Instant startedAt,
        String engine,
        String device,
        int chunksFetched,
        int chunksSynthesized,
        int chunksFailed,
        int chunksPlayed,
        int bufferedCount,
        Integer totalChunksEstimate,
        int percentComplete,
        long estimatedRemainingMs,
        Long timeToFirstAudioMs,
        boolean truncated
) {

    public static SessionResponse from(StreamingSession session) {
        ProgressSnapshot progress = session.progress();
        return new SessionResponse(
                session.id(),
                session.sourceId(),
                session.state(),
                session.isPaused(),
                session.startedAt(),
                session.engineName(),
                session.deviceName(),
                progress.chunksFetched(),
                progress.chunksSynthesized(),
                progress.chunksFailed(),
                progress.chunksPlayed(),
                progress.bufferedCount(),
                progress.totalChunksEstimate() > 0 ? progress.totalChunksEstimate() : null,
                progress.percentComplete(),
                progress.estimatedRemaining().toMillis(),
                toMillis(progress.timeToFirstAudio()),
                progress.truncated()
        );
    }

    private static Long toMillis(Duration duration) {
        return duration == null ? null : duration.toMillis();
    }
}
