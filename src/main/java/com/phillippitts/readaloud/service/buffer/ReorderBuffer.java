package com.phillippitts.readaloud.service.buffer;

import com.phillippitts.readaloud.domain.AudioArtifact;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Staging area that turns out-of-order synthesis completions into an in-order artifact stream.
 *
 * <p>Artifacts are held by index. Every insert releases the maximal contiguous prefix starting at
 * the next expected index into the downstream {@link ArtifactSink}, failed placeholders included.
 * Release is strictly ascending: only one thread forwards artifacts at a time, and an inserter
 * that finds another thread forwarding leaves its artifact to that thread.
 *
 * <p>Thread-safety: {@link #insert(AudioArtifact)} may be called concurrently by all workers.
 */
public final class ReorderBuffer {

    private static final Logger LOG = LogManager.getLogger(ReorderBuffer.class);

    private final ArtifactSink downstream;
    private final BufferOccupancy occupancy;
    private final ReentrantLock stateLock = new ReentrantLock();
    private final ReentrantLock releaseLock = new ReentrantLock();
    private final TreeMap<Integer, AudioArtifact> pending = new TreeMap<>();
    private int nextIndex;

    public ReorderBuffer(ArtifactSink downstream, BufferOccupancy occupancy) {
        this.downstream = Objects.requireNonNull(downstream, "downstream must not be null");
        this.occupancy = Objects.requireNonNull(occupancy, "occupancy must not be null");
    }

    /**
     * Adds an artifact and forwards every artifact that has become releasable.
     *
     * @param artifact completed or failed artifact; its index must not have been inserted before
     * @throws InterruptedException if interrupted while the downstream sink is full
     * @throws IllegalArgumentException if the index was already inserted or released
     */
    public void insert(AudioArtifact artifact) throws InterruptedException {
        Objects.requireNonNull(artifact, "artifact must not be null");
        stateLock.lock();
        try {
            int index = artifact.index();
            if (index < nextIndex || pending.containsKey(index)) {
                throw new IllegalArgumentException("Artifact " + index + " already inserted");
            }
            pending.put(index, artifact);
        } finally {
            stateLock.unlock();
        }
        occupancy.increment();
        drain();
    }

    /**
     * Removes and returns the maximal contiguous run of artifacts starting at the next expected
     * index, advancing that index past the run.
     *
     * @return released artifacts in ascending index order; empty if the next index is missing
     */
    public List<AudioArtifact> releaseReadyPrefix() {
        stateLock.lock();
        try {
            List<AudioArtifact> ready = new ArrayList<>();
            AudioArtifact next;
            while ((next = pending.remove(nextIndex)) != null) {
                ready.add(next);
                nextIndex++;
            }
            return ready;
        } finally {
            stateLock.unlock();
        }
    }

    private void drain() throws InterruptedException {
        while (true) {
            if (!releaseLock.tryLock()) {
                return;
            }
            try {
                List<AudioArtifact> ready;
                while (!(ready = releaseReadyPrefix()).isEmpty()) {
                    for (AudioArtifact artifact : ready) {
                        LOG.debug("Releasing artifact {} (ready={})", artifact.index(), artifact.isReady());
                        downstream.accept(artifact);
                    }
                }
            } finally {
                releaseLock.unlock();
            }
            // An insert that lost the tryLock race relies on this re-check.
            if (!hasReleasable()) {
                return;
            }
        }
    }

    private boolean hasReleasable() {
        stateLock.lock();
        try {
            return pending.containsKey(nextIndex);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return number of artifacts waiting for a lower index to arrive
     */
    public int size() {
        stateLock.lock();
        try {
            return pending.size();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return index the buffer will release next
     */
    public int nextExpectedIndex() {
        stateLock.lock();
        try {
            return nextIndex;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Removes everything still pending; used on cancellation so the caller can release resources.
     *
     * @return artifacts that were never released
     */
    public List<AudioArtifact> discardPending() {
        stateLock.lock();
        try {
            List<AudioArtifact> discarded = new ArrayList<>(pending.values());
            pending.clear();
            return discarded;
        } finally {
            stateLock.unlock();
        }
    }
}
