package com.phillippitts.readaloud.service.metrics;

import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.domain.PlaybackState;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class StreamingMetricsPublisherTest {

    @Test
    void shouldIgnoreCallsWithoutMetrics() {
        StreamingMetricsPublisher publisher = StreamingMetricsPublisher.NOOP;

        assertThat(publisher.isEnabled()).isFalse();
        assertThatCode(() -> {
            publisher.recordSynthesisSuccess("process", 1_000L);
            publisher.recordSynthesisFailure("process", FailureReason.TIMEOUT);
            publisher.recordTimeToFirstAudio(Duration.ofMillis(10));
            publisher.recordPlaybackRetry("file");
            publisher.recordSkipped();
            publisher.recordSessionFinished(PlaybackState.COMPLETED, Duration.ofSeconds(1));
        }).doesNotThrowAnyException();
    }

    @Test
    void shouldDelegateWithLowerCaseLabels() {
        // Arrange
        StreamingMetrics metrics = mock(StreamingMetrics.class);
        StreamingMetricsPublisher publisher = new StreamingMetricsPublisher(metrics);

        // Act
        publisher.recordSynthesisSuccess("process", 42L);
        publisher.recordSynthesisFailure("process", FailureReason.EMPTY_AUDIO);
        publisher.recordSessionFinished(PlaybackState.STOPPED, Duration.ofSeconds(3));

        // Assert
        assertThat(publisher.isEnabled()).isTrue();
        verify(metrics).recordSynthesisLatency("process", 42L);
        verify(metrics).incrementSynthesisSuccess("process");
        verify(metrics).incrementSynthesisFailure("process", "empty_audio");
        verify(metrics).recordSessionFinished("stopped", Duration.ofSeconds(3));
    }

    @Test
    void shouldSkipMissingTimeToFirstAudio() {
        StreamingMetrics metrics = mock(StreamingMetrics.class);
        StreamingMetricsPublisher publisher = new StreamingMetricsPublisher(metrics);

        publisher.recordTimeToFirstAudio(null);

        verifyNoInteractions(metrics);
    }
}
