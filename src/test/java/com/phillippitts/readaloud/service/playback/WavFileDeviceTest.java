package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.exception.PlaybackException;
import com.phillippitts.readaloud.service.audio.WavWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavFileDeviceTest {

    @TempDir
    Path tempDir;

    private AudioArtifact artifact(int index, int frames) throws Exception {
        Path wav = tempDir.resolve("chunk-" + index + ".wav");
        WavWriter.writePcm16LeMono(new byte[frames * 2], 16_000, wav);
        return AudioArtifact.ready(index, wav, Duration.ofMillis(frames / 16));
    }

    @Test
    void shouldConcatenatePlayedArtifactsIntoOneWav() throws Exception {
        // Arrange
        Path output = tempDir.resolve("session.wav");
        WavFileDevice device = new WavFileDevice(output);

        // Act
        for (AudioArtifact artifact : new AudioArtifact[] {artifact(0, 1600), artifact(1, 3200)}) {
            Playback playback = device.open(artifact);
            playback.start();
            assertThat(playback.awaitCompletion(Duration.ZERO)).isTrue();
            playback.close();
        }
        device.close();

        // Assert
        assertThat(device.framesWritten()).isEqualTo(4800);
        AudioFileFormat format = AudioSystem.getAudioFileFormat(output.toFile());
        assertThat(format.getFrameLength()).isEqualTo(4800);
        assertThat(format.getFormat().getSampleRate()).isEqualTo(16_000f);
        assertThat(tempDir.resolve("session.wav.part")).doesNotExist();
    }

    @Test
    void shouldWriteNothingWhenNothingPlayed() {
        Path output = tempDir.resolve("empty.wav");
        WavFileDevice device = new WavFileDevice(output);

        device.close();

        assertThat(output).doesNotExist();
    }

    @Test
    void shouldRejectPlaybackAfterClose() throws Exception {
        WavFileDevice device = new WavFileDevice(tempDir.resolve("closed.wav"));
        device.close();
        Playback playback = device.open(artifact(0, 160));

        assertThatThrownBy(playback::start).isInstanceOf(PlaybackException.class);
    }

    @Test
    void shouldReportUnreadableAudioAsPlaybackError() throws Exception {
        Path bogus = Files.writeString(tempDir.resolve("bogus.wav"), "nope");
        WavFileDevice device = new WavFileDevice(tempDir.resolve("out.wav"));
        Playback playback = device.open(AudioArtifact.ready(0, bogus, Duration.ofSeconds(1)));

        assertThatThrownBy(playback::start)
                .isInstanceOf(PlaybackException.class)
                .hasMessageContaining("Cannot append chunk 0");
    }
}
