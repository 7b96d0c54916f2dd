package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.exception.PlaybackException;
import com.phillippitts.readaloud.testutil.ProcessTestDoubles.FailingProcessFactory;
import com.phillippitts.readaloud.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.readaloud.testutil.ProcessTestDoubles.RecordingProcessFactory;
import com.phillippitts.readaloud.testutil.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalPlayerDeviceTest {

    private static final Duration POLL = Duration.ofMillis(100);
    private static final AudioArtifact ARTIFACT =
            AudioArtifact.ready(4, Path.of("/tmp/chunk-00004-1.wav"), Duration.ofSeconds(1));

    private static ExternalPlayerDevice device(RecordingProcessFactory factory) {
        return new ExternalPlayerDevice(PlayerCommand.APLAY, factory, Duration.ofMinutes(1));
    }

    @Test
    void shouldRunPlayerOnArtifactAudio() throws Exception {
        // Arrange
        RecordingProcessFactory factory = new RecordingProcessFactory(ProcessBehavior.success());
        Playback playback = device(factory).open(ARTIFACT);

        // Act
        playback.start();
        boolean finished = playback.awaitCompletion(POLL);

        // Assert
        assertThat(finished).isTrue();
        assertThat(factory.commands()).containsExactly(PlayerCommand.APLAY.commandFor(ARTIFACT.audio()));
    }

    @Test
    void shouldFailOnNonZeroPlayerExit() {
        // Arrange
        Playback playback = device(new RecordingProcessFactory(ProcessBehavior.exit(1, "no such device")))
                .open(ARTIFACT);
        playback.start();

        // Act & Assert
        assertThatThrownBy(() -> playback.awaitCompletion(POLL))
                .isInstanceOf(PlaybackException.class)
                .hasMessageContaining("exited with code 1");
    }

    @Test
    void shouldRestartChunkFromBeginningOnResume() throws Exception {
        // Arrange
        RecordingProcessFactory factory = new RecordingProcessFactory(ProcessBehavior.hanging());
        Playback playback = device(factory).open(ARTIFACT);
        playback.start();
        TestProcess first = factory.lastProcess();

        // Act
        playback.pause();
        boolean finishedWhilePaused = playback.awaitCompletion(Duration.ofMillis(20));
        playback.resume();

        // Assert
        assertThat(first.wasDestroyCalled()).isTrue();
        assertThat(finishedWhilePaused).isFalse();
        assertThat(factory.commands()).hasSize(2);
        assertThat(playback.awaitCompletion(Duration.ofMillis(20))).isFalse();

        // Act
        playback.stop();

        // Assert
        assertThat(playback.awaitCompletion(POLL)).isTrue();
        assertThat(factory.lastProcess().wasDestroyCalled()).isTrue();
    }

    @Test
    void shouldKillPlayerThatRunsTooLong() {
        // Arrange
        RecordingProcessFactory factory = new RecordingProcessFactory(ProcessBehavior.hanging());
        Playback playback = new ExternalPlayerDevice(PlayerCommand.APLAY, factory, Duration.ofMillis(20))
                .open(ARTIFACT);
        playback.start();

        // Act & Assert
        assertThatThrownBy(() -> playback.awaitCompletion(POLL))
                .isInstanceOf(PlaybackException.class)
                .hasMessageContaining("still running");
        assertThat(factory.lastProcess().wasDestroyCalled()).isTrue();
    }

    @Test
    void shouldReportPlayerThatCannotStart() {
        Playback playback = new ExternalPlayerDevice(PlayerCommand.APLAY, new FailingProcessFactory(),
                Duration.ofMinutes(1)).open(ARTIFACT);

        assertThatThrownBy(playback::start)
                .isInstanceOf(PlaybackException.class)
                .hasMessageContaining("Cannot start aplay");
    }

    @Test
    void shouldRejectArtifactWithoutAudio() {
        ExternalPlayerDevice device = device(new RecordingProcessFactory(ProcessBehavior.success()));

        assertThatThrownBy(() -> device.open(AudioArtifact.failed(2, FailureReason.TIMEOUT, "slow")))
                .isInstanceOf(PlaybackException.class);
        assertThat(device.preservesPositionOnPause()).isFalse();
    }
}
