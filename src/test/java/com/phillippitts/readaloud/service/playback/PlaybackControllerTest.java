package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.domain.PlaybackState;
import com.phillippitts.readaloud.exception.InvalidStateTransitionException;
import com.phillippitts.readaloud.exception.PlaybackException;
import com.phillippitts.readaloud.service.buffer.BufferOccupancy;
import com.phillippitts.readaloud.service.buffer.PlaybackBuffer;
import com.phillippitts.readaloud.service.metrics.StreamingMetricsPublisher;
import com.phillippitts.readaloud.service.progress.ProgressTracker;
import com.phillippitts.readaloud.service.synthesis.TempAudioStore;
import com.phillippitts.readaloud.testutil.RecordingPlaybackDevice;
import com.phillippitts.readaloud.testutil.RecordingProgressListener;
import com.phillippitts.readaloud.util.CancellationSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PlaybackControllerTest {

    private static final Duration AWAIT = Duration.ofSeconds(5);

    @TempDir
    Path tempDir;

    private final CancellationSignal cancellation = new CancellationSignal();
    private final RecordingProgressListener listener = new RecordingProgressListener();
    private final ExecutorService loopThread = Executors.newSingleThreadExecutor();
    private PlaybackBuffer buffer;
    private ProgressTracker tracker;
    private PlaybackStateMachine stateMachine;
    private TempAudioStore store;

    @BeforeEach
    void setUp() {
        BufferOccupancy occupancy = new BufferOccupancy(4, cancellation);
        buffer = new PlaybackBuffer(5, 2, occupancy, cancellation);
        tracker = new ProgressTracker("playback", listener, buffer::size);
        stateMachine = new PlaybackStateMachine(tracker::stateChanged);
        store = TempAudioStore.in(tempDir, "playback");
    }

    @AfterEach
    void tearDown() {
        cancellation.cancel();
        loopThread.shutdownNow();
        tracker.close();
        store.close();
    }

    private PlaybackController controller(RecordingPlaybackDevice device) {
        return new PlaybackController(buffer, device, stateMachine, tracker, store,
                StreamingMetricsPublisher.NOOP, cancellation);
    }

    private Future<Void> start(PlaybackController controller) {
        stateMachine.transition(PlaybackState.FETCHING);
        return loopThread.submit(() -> {
            controller.run();
            return null;
        });
    }

    private AudioArtifact ready(int index) throws IOException {
        Path audio = Files.createFile(store.fileFor(index, 1));
        return AudioArtifact.ready(index, audio, Duration.ofMillis(50));
    }

    private static AudioArtifact failed(int index) {
        return AudioArtifact.failed(index, FailureReason.TIMEOUT, "Timed out");
    }

    @Test
    void shouldPlayReadyArtifactsInOrderAndSkipFailedOnes() throws Exception {
        // Arrange
        RecordingPlaybackDevice device = new RecordingPlaybackDevice(Duration.ofMillis(30));
        AudioArtifact first = ready(0);
        AudioArtifact last = ready(2);
        buffer.accept(first);
        buffer.accept(failed(1));
        buffer.accept(last);
        buffer.close();

        // Act
        start(controller(device)).get(5, TimeUnit.SECONDS);

        // Assert
        assertThat(device.started()).containsExactly(0, 2);
        assertThat(device.finished()).containsExactly(0, 2);
        assertThat(tracker.chunksPlayed()).isEqualTo(2);
        assertThat(listener.states()).contains(PlaybackState.PLAYING).doesNotContain(PlaybackState.PAUSED);
        assertThat(first.audio()).doesNotExist();
        assertThat(last.audio()).doesNotExist();
    }

    @Test
    void shouldWaitInBufferingUntilLowWatermark() throws Exception {
        // Arrange
        RecordingPlaybackDevice device = new RecordingPlaybackDevice(Duration.ofMillis(20));
        buffer.accept(ready(0));
        Future<Void> loop = start(controller(device));
        await().atMost(AWAIT).until(() -> stateMachine.current() == PlaybackState.BUFFERING);
        assertThat(device.started()).isEmpty();

        // Act
        buffer.accept(ready(1));
        buffer.close();

        // Assert
        loop.get(5, TimeUnit.SECONDS);
        assertThat(device.started()).containsExactly(0, 1);
        assertThat(listener.states()).containsSubsequence(
                PlaybackState.FETCHING, PlaybackState.BUFFERING, PlaybackState.PLAYING);
    }

    @Test
    void shouldSkipCurrentChunk() throws Exception {
        // Arrange
        RecordingPlaybackDevice device = new RecordingPlaybackDevice(Duration.ofSeconds(10));
        buffer.accept(ready(0));
        buffer.accept(ready(1));
        buffer.close();
        PlaybackController controller = controller(device);
        Future<Void> loop = start(controller);
        await().atMost(AWAIT).until(() -> device.started().contains(0));

        // Act
        boolean skippedFirst = controller.skip();
        await().atMost(AWAIT).until(() -> device.started().contains(1));
        boolean skippedSecond = controller.skip();

        // Assert
        loop.get(5, TimeUnit.SECONDS);
        assertThat(skippedFirst).isTrue();
        assertThat(skippedSecond).isTrue();
        assertThat(device.stopped()).containsExactly(0, 1);
        assertThat(device.finished()).isEmpty();
        assertThat(tracker.summary().chunksSkipped()).isEqualTo(2);
    }

    @Test
    void shouldResumeFromPausedPointWithoutReplaying() throws Exception {
        // Arrange
        RecordingPlaybackDevice device = new RecordingPlaybackDevice(Duration.ofMillis(300));
        buffer.accept(ready(0));
        buffer.accept(ready(1));
        buffer.close();
        PlaybackController controller = controller(device);
        Future<Void> loop = start(controller);
        await().atMost(AWAIT).until(() -> device.started().contains(0));

        // Act
        controller.pause();

        // Assert
        assertThat(controller.isPaused()).isTrue();
        assertThat(stateMachine.current()).isEqualTo(PlaybackState.PAUSED);
        assertThat(device.pauses()).isEqualTo(1);
        await().during(Duration.ofMillis(400)).atMost(Duration.ofSeconds(2))
                .until(() -> device.finished().isEmpty());

        // Act
        controller.resume();

        // Assert
        loop.get(5, TimeUnit.SECONDS);
        assertThat(device.started()).containsExactly(0, 1);
        assertThat(device.finished()).containsExactly(0, 1);
        assertThat(tracker.chunksPlayed()).isEqualTo(2);
    }

    @Test
    void shouldTreatRepeatedPauseAndResumeAsNoOps() throws Exception {
        // Arrange
        RecordingPlaybackDevice device = new RecordingPlaybackDevice(Duration.ofSeconds(10));
        buffer.accept(ready(0));
        buffer.accept(ready(1));
        PlaybackController controller = controller(device);
        start(controller);
        await().atMost(AWAIT).until(() -> device.started().contains(0));

        // Act
        controller.resume();
        controller.pause();
        controller.pause();

        // Assert
        assertThat(device.pauses()).isEqualTo(1);
        assertThat(listener.states()).containsOnlyOnce(PlaybackState.PAUSED);
    }

    @Test
    void shouldRejectPauseBeforeSessionStarts() {
        PlaybackController controller = controller(new RecordingPlaybackDevice(Duration.ofMillis(10)));

        assertThatThrownBy(controller::pause).isInstanceOf(InvalidStateTransitionException.class);
        assertThat(controller.skip()).isFalse();
    }

    @Test
    void shouldRetryFailedStartOnce() throws Exception {
        // Arrange
        RecordingPlaybackDevice device = new RecordingPlaybackDevice(Duration.ofMillis(20)).failStart(0, 1);
        buffer.accept(ready(0));
        buffer.close();

        // Act
        start(controller(device)).get(5, TimeUnit.SECONDS);

        // Assert
        assertThat(device.finished()).containsExactly(0);
        assertThat(tracker.summary().playbackRetries()).isEqualTo(1);
        assertThat(tracker.chunksPlayed()).isEqualTo(1);
    }

    @Test
    void shouldFailWhenRetryAlsoFails() throws Exception {
        // Arrange
        RecordingPlaybackDevice device = new RecordingPlaybackDevice(Duration.ofMillis(20)).failStart(0, 2);
        AudioArtifact artifact = ready(0);
        buffer.accept(artifact);
        buffer.close();

        // Act
        Future<Void> loop = start(controller(device));

        // Assert
        assertThatThrownBy(() -> loop.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(PlaybackException.class);
        assertThat(device.started()).isEmpty();
        assertThat(artifact.audio()).doesNotExist();
    }

    @Test
    void shouldStopImmediatelyAndReleaseBufferedAudio() throws Exception {
        // Arrange
        RecordingPlaybackDevice device = new RecordingPlaybackDevice(Duration.ofSeconds(10));
        buffer.accept(ready(0));
        buffer.accept(ready(1));
        AudioArtifact queued = ready(2);
        buffer.accept(queued);
        PlaybackController controller = controller(device);
        Future<Void> loop = start(controller);
        await().atMost(AWAIT).until(() -> device.started().contains(0));

        // Act
        controller.stop();

        // Assert
        assertThatThrownBy(() -> loop.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CancellationException.class);
        assertThat(stateMachine.current()).isEqualTo(PlaybackState.STOPPED);
        assertThat(device.stopped()).contains(0);
        assertThat(buffer.isEmpty()).isTrue();
        assertThat(queued.audio()).doesNotExist();
        assertThat(tracker.chunksPlayed()).isEqualTo(1);
    }

    @Test
    void shouldRejectCommandsAfterStop() {
        // Arrange
        PlaybackController controller = controller(new RecordingPlaybackDevice(Duration.ofMillis(10)));
        stateMachine.transition(PlaybackState.FETCHING);
        controller.stop();

        // Act + Assert
        assertThatThrownBy(controller::resume).isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(controller::skip).isInstanceOf(InvalidStateTransitionException.class);
        controller.stop();
        assertThat(stateMachine.current()).isEqualTo(PlaybackState.STOPPED);
    }
}
