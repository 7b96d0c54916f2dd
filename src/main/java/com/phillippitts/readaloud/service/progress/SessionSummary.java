package com.phillippitts.readaloud.service.progress;

import com.phillippitts.readaloud.domain.PlaybackState;

import java.time.Duration;

/**
 * Statistics of a session, logged when it reaches a terminal state.
 *
 * @param sessionId        session id
 * @param state            state at the time the summary was taken
 * @param chunksFetched    chunks emitted by the feeder
 * @param chunksPlayed     artifacts whose playback started
 * @param chunksFailed     chunks that failed synthesis
 * @param chunksSkipped    artifacts skipped by user command
 * @param playbackRetries  artifacts replayed after a playback error
 * @param timeToFirstAudio delay until the first playback, {@code null} if nothing played
 * @param elapsed          time since the session started
 * @param truncated        whether the source ended early
 */
public record SessionSummary(
        String sessionId,
        PlaybackState state,
        int chunksFetched,
        int chunksPlayed,
        int chunksFailed,
        int chunksSkipped,
        int playbackRetries,
        Duration timeToFirstAudio,
        Duration elapsed,
        boolean truncated
) {}
