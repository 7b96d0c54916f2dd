package com.phillippitts.readaloud.service.synthesis;

import com.phillippitts.readaloud.domain.VoiceParams;
import com.phillippitts.readaloud.exception.SynthesisException;
import com.phillippitts.readaloud.service.audio.AudioDurations;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioSystem;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SilentSynthesisEngineTest {

    private static final VoiceParams VOICE = VoiceParams.forLanguage("en-us");

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteSilenceSizedToSpeakingRate() throws Exception {
        // Arrange
        SilentSynthesisEngine engine = new SilentSynthesisEngine();
        engine.initialize();
        Path output = tempDir.resolve("silent.wav");
        String text = "Fifteen chars!!";

        // Act
        SynthesisResult result = engine.synthesize(text, VOICE, output);

        // Assert
        assertThat(result.durationEstimate()).isEqualTo(Duration.ofSeconds(1));
        AudioFileFormat format = AudioSystem.getAudioFileFormat(output.toFile());
        assertThat(format.getFormat().getSampleRate()).isEqualTo(16_000f);
        assertThat(format.getFrameLength()).isEqualTo(16_000);
        assertThat(AudioDurations.of(output, text)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void shouldCapSilenceAtMaximumDuration() {
        SilentSynthesisEngine engine = new SilentSynthesisEngine(Duration.ofMillis(100));
        engine.initialize();

        SynthesisResult result = engine.synthesize("x".repeat(300), VOICE, tempDir.resolve("capped.wav"));

        assertThat(result.durationEstimate()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void shouldRefuseToSynthesizeAfterClose() {
        SilentSynthesisEngine engine = new SilentSynthesisEngine();
        engine.initialize();
        engine.close();

        assertThat(engine.isHealthy()).isFalse();
        assertThatThrownBy(() -> engine.synthesize("Hello.", VOICE, tempDir.resolve("closed.wav")))
                .isInstanceOf(SynthesisException.class);
    }
}
