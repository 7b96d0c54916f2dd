package com.phillippitts.readaloud.service.progress;

import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.domain.PlaybackState;
import com.phillippitts.readaloud.service.progress.event.ChunkFailedEvent;
import com.phillippitts.readaloud.service.progress.event.PlaybackStateChangedEvent;
import com.phillippitts.readaloud.service.progress.event.ProgressUpdatedEvent;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ApplicationEventProgressListenerTest {

    @Test
    void shouldPublishEventsOnApplicationBus() {
        // Arrange
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        ApplicationEventProgressListener listener = new ApplicationEventProgressListener(publisher);
        ChunkFailedEvent failed = new ChunkFailedEvent("s1", 2, FailureReason.TIMEOUT, "slow", Instant.now());
        PlaybackStateChangedEvent changed = new PlaybackStateChangedEvent("s1", PlaybackState.IDLE,
                PlaybackState.BUFFERING, Instant.now());

        // Act
        listener.onChunkFailed(failed);
        listener.onStateChanged(changed);

        // Assert
        verify(publisher).publishEvent(failed);
        verify(publisher).publishEvent(changed);
    }

    @Test
    void shouldFanOutToAllListenersInOrder() {
        // Arrange
        List<String> calls = new ArrayList<>();
        ProgressListener first = new ProgressListener() {
            @Override
            public void onProgress(ProgressUpdatedEvent event) {
            }

            @Override
            public void onChunkFailed(ChunkFailedEvent event) {
                calls.add("first-" + event.index());
            }
        };
        ProgressListener second = new ProgressListener() {
            @Override
            public void onProgress(ProgressUpdatedEvent event) {
            }

            @Override
            public void onChunkFailed(ChunkFailedEvent event) {
                calls.add("second-" + event.index());
            }
        };

        // Act
        ProgressListener.composite(List.of(first, ProgressListener.NOOP, second))
                .onChunkFailed(new ChunkFailedEvent("s1", 7, FailureReason.ENGINE_ERROR, "x", Instant.now()));

        // Assert
        assertThat(calls).containsExactly("first-7", "second-7");
    }
}
