package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.exception.PlaybackException;
import com.phillippitts.readaloud.service.audio.WavWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import javax.sound.sampled.Clip;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineListener;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JavaSoundPlaybackDeviceTest {

    @TempDir
    Path tempDir;

    private final Clip clip = mock(Clip.class);
    private JavaSoundPlaybackDevice device;
    private AudioArtifact artifact;

    @BeforeEach
    void setUp() throws Exception {
        device = new JavaSoundPlaybackDevice(stream -> clip);
        Path wav = tempDir.resolve("chunk.wav");
        WavWriter.writePcm16LeMono(new byte[3200], 16_000, wav);
        artifact = AudioArtifact.ready(0, wav, Duration.ofMillis(100));
    }

    private LineListener listener() {
        ArgumentCaptor<LineListener> captor = ArgumentCaptor.forClass(LineListener.class);
        verify(clip).addLineListener(captor.capture());
        return captor.getValue();
    }

    private LineEvent stopEvent() {
        return new LineEvent(clip, LineEvent.Type.STOP, 0);
    }

    @Test
    void shouldCompleteWhenClipStops() throws Exception {
        // Arrange
        Playback playback = device.open(artifact);
        playback.start();

        // Act
        listener().update(stopEvent());

        // Assert
        verify(clip).start();
        assertThat(playback.awaitCompletion(Duration.ofMillis(10))).isTrue();
    }

    @Test
    void shouldNotCompleteWhenStoppedByPause() throws Exception {
        // Arrange
        when(clip.getFramePosition()).thenReturn(800);
        when(clip.getFrameLength()).thenReturn(1600);
        Playback playback = device.open(artifact);
        playback.start();

        // Act
        playback.pause();
        listener().update(stopEvent());

        // Assert
        assertThat(playback.awaitCompletion(Duration.ofMillis(10))).isFalse();

        // Act
        playback.resume();
        listener().update(stopEvent());

        // Assert
        assertThat(playback.awaitCompletion(Duration.ofMillis(10))).isTrue();
    }

    @Test
    void shouldIgnorePauseStopEventDeliveredAfterResume() throws Exception {
        // Arrange
        when(clip.isRunning()).thenReturn(true);
        when(clip.getFramePosition()).thenReturn(800);
        when(clip.getFrameLength()).thenReturn(1600);
        Playback playback = device.open(artifact);
        playback.start();
        playback.pause();
        playback.resume();

        // Act: the STOP caused by the pause arrives late
        listener().update(stopEvent());

        // Assert
        assertThat(playback.awaitCompletion(Duration.ofMillis(10))).isFalse();
        verify(clip, times(2)).start();

        // Act: the clip reaches its end
        listener().update(stopEvent());

        // Assert
        assertThat(playback.awaitCompletion(Duration.ofMillis(10))).isTrue();
    }

    @Test
    void shouldCompleteOnStopAndCloseClip() throws Exception {
        Playback playback = device.open(artifact);
        playback.start();

        playback.stop();
        playback.close();
        playback.close();

        assertThat(playback.awaitCompletion(Duration.ZERO)).isTrue();
        verify(clip).close();
    }

    @Test
    void shouldWrapUnreadableAudio() {
        AudioArtifact missing = AudioArtifact.ready(1, tempDir.resolve("missing.wav"), Duration.ofSeconds(1));

        assertThatThrownBy(() -> device.open(missing))
                .isInstanceOf(PlaybackException.class)
                .hasMessageContaining("Cannot open chunk 1");
    }

    @Test
    void shouldReportDeviceName() {
        assertThat(device.getDeviceName()).isEqualTo(JavaSoundPlaybackDevice.DEVICE_NAME);
        assertThat(device.preservesPositionOnPause()).isTrue();
        verifyNoInteractions(clip);
    }
}
