package com.phillippitts.readaloud.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Synthesized audio for one chunk, or a placeholder recording why there is none.
 *
 * <p>An artifact is owned by exactly one component at a time (worker, reorder buffer, playback
 * buffer, controller); ownership moves along the pipeline and the record itself is immutable.
 *
 * @param index            index of the chunk this artifact belongs to
 * @param audio            audio file; {@code null} for failed artifacts
 * @param durationEstimate estimated playing time; {@link Duration#ZERO} for failed artifacts
 * @param failureReason    {@code null} when ready
 * @param failureDetail    human-readable failure detail; {@code null} when ready
 */
public record AudioArtifact(
        int index,
        Path audio,
        Duration durationEstimate,
        FailureReason failureReason,
        String failureDetail
) {

    public AudioArtifact {
        if (index < 0) {
            throw new IllegalArgumentException("Artifact index must not be negative, got: " + index);
        }
        Objects.requireNonNull(durationEstimate, "durationEstimate must not be null");
        if (failureReason == null) {
            Objects.requireNonNull(audio, "audio must not be null for a ready artifact");
        }
    }

    public static AudioArtifact ready(int index, Path audio, Duration durationEstimate) {
        return new AudioArtifact(index, audio, durationEstimate, null, null);
    }

    public static AudioArtifact failed(int index, FailureReason reason, String detail) {
        Objects.requireNonNull(reason, "reason must not be null");
        return new AudioArtifact(index, null, Duration.ZERO, reason, detail);
    }

    public boolean isReady() {
        return failureReason == null;
    }
}
