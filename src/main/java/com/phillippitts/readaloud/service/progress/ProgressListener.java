package com.phillippitts.readaloud.service.progress;

import com.phillippitts.readaloud.service.progress.event.ChunkFailedEvent;
import com.phillippitts.readaloud.service.progress.event.PlaybackStateChangedEvent;
import com.phillippitts.readaloud.service.progress.event.ProgressUpdatedEvent;

import java.util.List;

/**
 * Notification sink for a session: rate-limited progress snapshots plus discrete events that are
 * delivered as they happen.
 *
 * <p>Implementations must return quickly; they are called from pipeline threads.
 */
public interface ProgressListener {

    /** Listener that ignores everything. */
    ProgressListener NOOP = new ProgressListener() {
        @Override
        public void onProgress(ProgressUpdatedEvent event) {
        }
    };

    void onProgress(ProgressUpdatedEvent event);

    default void onChunkFailed(ChunkFailedEvent event) {
    }

    default void onStateChanged(PlaybackStateChangedEvent event) {
    }

    /**
     * Fans every notification out to all given listeners, in order.
     *
     * @param listeners listeners to notify
     * @return composite listener
     */
    static ProgressListener composite(List<ProgressListener> listeners) {
        List<ProgressListener> copy = List.copyOf(listeners);
        return new ProgressListener() {
            @Override
            public void onProgress(ProgressUpdatedEvent event) {
                copy.forEach(l -> l.onProgress(event));
            }

            @Override
            public void onChunkFailed(ChunkFailedEvent event) {
                copy.forEach(l -> l.onChunkFailed(event));
            }

            @Override
            public void onStateChanged(PlaybackStateChangedEvent event) {
                copy.forEach(l -> l.onStateChanged(event));
            }
        };
    }
}
