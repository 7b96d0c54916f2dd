package com.phillippitts.readaloud.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainRecordsTest {

    @Test
    void shouldRejectBlankOrNegativeChunks() {
        assertThatThrownBy(() -> new TextChunk(-1, "text"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TextChunk(0, "   "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TextChunk(0, null))
                .isInstanceOf(NullPointerException.class);
        assertThat(new TextChunk(3, "Hello.").charCount()).isEqualTo(6);
    }

    @Test
    void shouldUseLanguageAsDefaultVoice() {
        assertThat(VoiceParams.forLanguage("es").voice()).isEqualTo("es");
        assertThat(new VoiceParams("  ", "de").voice()).isEqualTo("de");
        assertThat(new VoiceParams("en-gb-x-rp", "en").voice()).isEqualTo("en-gb-x-rp");
        assertThatThrownBy(() -> new VoiceParams("v", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDistinguishReadyAndFailedArtifacts() {
        AudioArtifact ready = AudioArtifact.ready(0, Path.of("chunk-0.wav"), Duration.ofSeconds(2));
        AudioArtifact failed = AudioArtifact.failed(1, FailureReason.TIMEOUT, "took too long");

        assertThat(ready.isReady()).isTrue();
        assertThat(failed.isReady()).isFalse();
        assertThat(failed.audio()).isNull();
        assertThat(failed.durationEstimate()).isEqualTo(Duration.ZERO);
        assertThatThrownBy(() -> AudioArtifact.ready(2, null, Duration.ZERO))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldComputePercentCompleteFromPlayedAndFailed() {
        assertThat(snapshot(2, 1, 4).percentComplete()).isEqualTo(75);
        assertThat(snapshot(1, 0, 3).percentComplete()).isEqualTo(33);
        assertThat(snapshot(5, 0, 0).percentComplete()).isZero();
        assertThat(snapshot(5, 1, 4).percentComplete()).isEqualTo(100);
    }

    @Test
    void shouldLabelFailureReasonsInLowerCase() {
        assertThat(FailureReason.ENGINE_ERROR.label()).isEqualTo("engine_error");
        assertThat(FailureReason.TIMEOUT.label()).isEqualTo("timeout");
    }

    private static ProgressSnapshot snapshot(int played, int failed, int total) {
        return new ProgressSnapshot("s1", PlaybackState.PLAYING, total, played, failed, played, 0, total,
                Duration.ZERO, false, null, Instant.now());
    }
}
