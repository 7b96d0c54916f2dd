package com.phillippitts.readaloud.service.synthesis;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Audio written by one successful synthesis call.
 *
 * @param audio            file holding the audio
 * @param durationEstimate estimated playing time
 */
public record SynthesisResult(Path audio, Duration durationEstimate) {

    public SynthesisResult {
        Objects.requireNonNull(audio, "audio must not be null");
        Objects.requireNonNull(durationEstimate, "durationEstimate must not be null");
    }
}
