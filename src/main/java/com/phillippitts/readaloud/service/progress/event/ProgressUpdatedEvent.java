package com.phillippitts.readaloud.service.progress.event;

import com.phillippitts.readaloud.domain.ProgressSnapshot;

/**
 * Rate-limited progress publication of a session.
 *
 * @param snapshot the published snapshot
 * @param terminal whether this is the final snapshot of the session
 */
public record ProgressUpdatedEvent(ProgressSnapshot snapshot, boolean terminal) {}
