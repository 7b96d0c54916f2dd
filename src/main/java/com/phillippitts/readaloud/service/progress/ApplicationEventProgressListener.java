package com.phillippitts.readaloud.service.progress;

import com.phillippitts.readaloud.service.progress.event.ChunkFailedEvent;
import com.phillippitts.readaloud.service.progress.event.PlaybackStateChangedEvent;
import com.phillippitts.readaloud.service.progress.event.ProgressUpdatedEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Bridges session notifications onto the Spring application event bus so that any
 * {@code @EventListener} (logging, metrics, UI adapters) can observe every session.
 */
@Component
public class ApplicationEventProgressListener implements ProgressListener {

    private final ApplicationEventPublisher publisher;

    public ApplicationEventProgressListener(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @Override
    public void onProgress(ProgressUpdatedEvent event) {
        publisher.publishEvent(event);
    }

    @Override
    public void onChunkFailed(ChunkFailedEvent event) {
        publisher.publishEvent(event);
    }

    @Override
    public void onStateChanged(PlaybackStateChangedEvent event) {
        publisher.publishEvent(event);
    }
}
