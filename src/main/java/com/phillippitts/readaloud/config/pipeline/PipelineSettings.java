package com.phillippitts.readaloud.config.pipeline;

import com.phillippitts.readaloud.config.properties.ChunkingProperties;
import com.phillippitts.readaloud.config.properties.FeederProperties;
import com.phillippitts.readaloud.config.properties.PlaybackProperties;
import com.phillippitts.readaloud.config.properties.ProgressProperties;
import com.phillippitts.readaloud.config.properties.SynthesisProperties;
import com.phillippitts.readaloud.domain.VoiceParams;
import com.phillippitts.readaloud.service.segment.ProtectedPatterns;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings of one streaming session, resolved from configuration and per-request
 * overrides. Validated on construction.
 *
 * @param minChunkSize          smallest chunk the segmenter closes on its own
 * @param maxChunkSize          largest chunk for splittable text
 * @param protectedPatterns     tokens never split
 * @param segmentThresholdChars buffered characters that trigger a segmentation pass
 * @param maxChars              source character cap, 0 for none
 * @param workQueueCapacity     chunks the feeder may run ahead of the workers
 * @param workers               synthesis workers
 * @param synthesisTimeout      per-chunk synthesis timeout
 * @param retryFailedOnce       retry a failed synthesis once before marking the chunk failed
 * @param voice                 voice and language passed to the engine
 * @param playbackCapacity      playback buffer capacity
 * @param lowWatermark          artifacts the controller waits for before (re)starting playback
 * @param highWatermark         combined buffered artifacts at which workers stop pulling chunks
 * @param publishInterval       minimum interval between progress publications
 */
public record PipelineSettings(
        int minChunkSize,
        int maxChunkSize,
        ProtectedPatterns protectedPatterns,
        int segmentThresholdChars,
        int maxChars,
        int workQueueCapacity,
        int workers,
        Duration synthesisTimeout,
        boolean retryFailedOnce,
        VoiceParams voice,
        int playbackCapacity,
        int lowWatermark,
        int highWatermark,
        Duration publishInterval
) {

    public PipelineSettings {
        Objects.requireNonNull(protectedPatterns, "protectedPatterns must not be null");
        Objects.requireNonNull(synthesisTimeout, "synthesisTimeout must not be null");
        Objects.requireNonNull(voice, "voice must not be null");
        Objects.requireNonNull(publishInterval, "publishInterval must not be null");
        require(minChunkSize > 0 && minChunkSize <= maxChunkSize,
                "chunk size band invalid: [" + minChunkSize + ", " + maxChunkSize + "]");
        require(segmentThresholdChars >= 2 * maxChunkSize,
                "segment threshold must be at least twice the max chunk size");
        require(maxChars >= 0, "maxChars must not be negative");
        require(workQueueCapacity > 0, "work queue capacity must be positive");
        require(workers > 0, "worker count must be positive");
        require(!synthesisTimeout.isNegative() && !synthesisTimeout.isZero(), "synthesis timeout must be positive");
        require(playbackCapacity > 0, "playback capacity must be positive");
        require(lowWatermark > 0 && lowWatermark <= highWatermark && lowWatermark <= playbackCapacity,
                "watermarks must satisfy 0 < low <= high and low <= capacity");
        require(!publishInterval.isNegative() && !publishInterval.isZero(), "publish interval must be positive");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Resolves settings from the bound configuration properties.
     */
    public static PipelineSettings from(ChunkingProperties chunking,
                                        FeederProperties feeder,
                                        SynthesisProperties synthesis,
                                        PlaybackProperties playback,
                                        ProgressProperties progress) {
        return builder()
                .chunkSizes(chunking.minSize(), chunking.maxSize())
                .protectedPatterns(chunking.protectedPatterns())
                .segmentThresholdChars(feeder.segmentThresholdChars())
                .maxChars(feeder.maxChars())
                .workQueueCapacity(feeder.workQueueCapacity())
                .workers(synthesis.workers())
                .synthesisTimeout(Duration.ofMillis(synthesis.timeoutMs()))
                .retryFailedOnce(synthesis.retryFailedOnce())
                .voice(new VoiceParams(synthesis.voice(), synthesis.language()))
                .playbackBuffer(playback.capacity(), playback.lowWatermark(), playback.highWatermark())
                .publishInterval(Duration.ofMillis(progress.publishIntervalMs()))
                .build();
    }

    /**
     * @return a builder pre-filled with these settings
     */
    public Builder toBuilder() {
        return new Builder()
                .chunkSizes(minChunkSize, maxChunkSize)
                .protectedPatterns(protectedPatterns)
                .segmentThresholdChars(segmentThresholdChars)
                .maxChars(maxChars)
                .workQueueCapacity(workQueueCapacity)
                .workers(workers)
                .synthesisTimeout(synthesisTimeout)
                .retryFailedOnce(retryFailedOnce)
                .voice(voice)
                .playbackBuffer(playbackCapacity, lowWatermark, highWatermark)
                .publishInterval(publishInterval);
    }

    /**
     * @return a builder with the default configuration values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; unset values keep the defaults of application.properties.
     */
    public static final class Builder {
        private int minChunkSize = 40;
        private int maxChunkSize = 300;
        private ProtectedPatterns protectedPatterns = ProtectedPatterns.defaults();
        private int segmentThresholdChars = 4096;
        private int maxChars;
        private int workQueueCapacity = 8;
        private int workers = 2;
        private Duration synthesisTimeout = Duration.ofSeconds(30);
        private boolean retryFailedOnce;
        private VoiceParams voice = VoiceParams.forLanguage("en-us");
        private int playbackCapacity = 5;
        private int lowWatermark = 2;
        private int highWatermark = 4;
        private Duration publishInterval = Duration.ofSeconds(2);

        private Builder() {
        }

        public Builder chunkSizes(int min, int max) {
            this.minChunkSize = min;
            this.maxChunkSize = max;
            return this;
        }

        public Builder protectedPatterns(List<String> patterns) {
            this.protectedPatterns = ProtectedPatterns.of(patterns);
            return this;
        }

        public Builder protectedPatterns(ProtectedPatterns patterns) {
            this.protectedPatterns = patterns;
            return this;
        }

        public Builder segmentThresholdChars(int chars) {
            this.segmentThresholdChars = chars;
            return this;
        }

        public Builder maxChars(int chars) {
            this.maxChars = chars;
            return this;
        }

        public Builder workQueueCapacity(int capacity) {
            this.workQueueCapacity = capacity;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder synthesisTimeout(Duration timeout) {
            this.synthesisTimeout = timeout;
            return this;
        }

        public Builder retryFailedOnce(boolean retry) {
            this.retryFailedOnce = retry;
            return this;
        }

        public Builder voice(VoiceParams voice) {
            this.voice = voice;
            return this;
        }

        public Builder playbackBuffer(int capacity, int low, int high) {
            this.playbackCapacity = capacity;
            this.lowWatermark = low;
            this.highWatermark = high;
            return this;
        }

        public Builder publishInterval(Duration interval) {
            this.publishInterval = interval;
            return this;
        }

        public PipelineSettings build() {
            return new PipelineSettings(minChunkSize, maxChunkSize, protectedPatterns, segmentThresholdChars,
                    maxChars, workQueueCapacity, workers, synthesisTimeout, retryFailedOnce, voice,
                    playbackCapacity, lowWatermark, highWatermark, publishInterval);
        }
    }
}
