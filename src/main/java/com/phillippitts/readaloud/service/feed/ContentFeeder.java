package com.phillippitts.readaloud.service.feed;

import com.phillippitts.readaloud.config.pipeline.PipelineSettings;
import com.phillippitts.readaloud.domain.TextChunk;
import com.phillippitts.readaloud.exception.FetchException;
import com.phillippitts.readaloud.service.buffer.ChunkSink;
import com.phillippitts.readaloud.service.progress.ProgressTracker;
import com.phillippitts.readaloud.service.segment.Segmenter;
import com.phillippitts.readaloud.util.CancellationSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;

/**
 * Reads a {@link ContentSource} incrementally and emits indexed chunks in order.
 *
 * <p>Text accumulates in a local buffer. Once the buffer reaches the segment threshold it is
 * segmented and every chunk except the trailing ones is emitted; the trailing chunks go back into
 * the buffer because text still to come may extend their last sentence (or word). When the source
 * is exhausted the remainder is segmented and emitted completely. Indices continue across passes.
 *
 * <p>One feeder instance serves one session; it is not thread-safe.
 */
public final class ContentFeeder {

    private static final Logger LOG = LogManager.getLogger(ContentFeeder.class);

    private final Segmenter segmenter;
    private final PipelineSettings settings;

    private final StringBuilder buffer = new StringBuilder();
    private int nextIndex;
    private long emittedChars;
    private long consumed;

    public ContentFeeder(Segmenter segmenter, PipelineSettings settings) {
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Feeds the whole source into the sink.
     *
     * @param source       text source; not closed by this method
     * @param sink         destination of the chunks, in index order
     * @param tracker      receives fetched-chunk and estimate updates
     * @param cancellation session cancellation signal
     * @return counts of the completed feed
     * @throws FetchException if the source fails; text read before the failure is emitted first
     * @throws InterruptedException if interrupted while the sink is full
     * @throws CancellationException if the session is cancelled
     */
    public FeedResult feed(ContentSource source, ChunkSink sink, ProgressTracker tracker,
                           CancellationSignal cancellation) throws InterruptedException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(tracker, "tracker must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        OptionalLong expectedLength = source.estimatedLength();
        boolean capped = false;
        while (true) {
            cancellation.throwIfCancelled();
            Optional<String> piece = readNext(source, sink, tracker, cancellation);
            if (piece.isEmpty()) {
                break;
            }
            capped = append(piece.get());
            if (capped) {
                LOG.info("Source {} capped at {} chars", source.sourceId(), settings.maxChars());
                break;
            }
            if (buffer.length() >= settings.segmentThresholdChars()) {
                emitSettled(sink, tracker);
            }
            tracker.totalEstimateUpdated(estimateTotal(expectedLength));
        }

        emitAll(sink, tracker);
        tracker.totalKnown(nextIndex);
        LOG.debug("Feed of {} finished: {} chunks from {} chars", source.sourceId(), nextIndex, consumed);
        return new FeedResult(nextIndex, capped);
    }

    private Optional<String> readNext(ContentSource source, ChunkSink sink, ProgressTracker tracker,
                                      CancellationSignal cancellation) throws InterruptedException {
        try {
            return source.read();
        } catch (IOException e) {
            if (cancellation.isCancelled()) {
                throw new CancellationException("Source closed by cancellation");
            }
            LOG.warn("Source {} failed after {} chars: {}", source.sourceId(), consumed, e.toString());
            emitAll(sink, tracker);
            tracker.totalKnown(nextIndex);
            throw new FetchException("Read failed after " + consumed + " chars", source.sourceId(), e);
        }
    }

    /**
     * Appends a piece, applying the character cap.
     *
     * @return whether the cap was hit and reading must stop
     */
    private boolean append(String piece) {
        int maxChars = settings.maxChars();
        if (maxChars <= 0 || consumed + piece.length() <= maxChars) {
            buffer.append(piece);
            consumed += piece.length();
            return false;
        }
        int keep = (int) (maxChars - consumed);
        buffer.append(piece, 0, keep);
        consumed += keep;
        boolean cutInsideWord = !Character.isWhitespace(piece.charAt(keep))
                && buffer.length() > 0
                && !Character.isWhitespace(buffer.charAt(buffer.length() - 1));
        if (cutInsideWord) {
            dropTrailingPartialWord();
        }
        return true;
    }

    private void dropTrailingPartialWord() {
        for (int i = buffer.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(buffer.charAt(i))) {
                buffer.setLength(i);
                return;
            }
        }
        buffer.setLength(0);
    }

    private void emitSettled(ChunkSink sink, ProgressTracker tracker) throws InterruptedException {
        List<TextChunk> chunks = segment();
        if (chunks.isEmpty()) {
            buffer.setLength(0);
            return;
        }
        boolean trailingSpace = Character.isWhitespace(buffer.charAt(buffer.length() - 1));

        // Keep enough trailing text that a protected token straddling the next read is still seen whole.
        int guard = settings.protectedPatterns().longestLength() + 2;
        int carry = 1;
        int carriedLength = chunks.get(chunks.size() - 1).charCount();
        while (carry < chunks.size() && carriedLength < guard) {
            carry++;
            carriedLength += chunks.get(chunks.size() - carry).charCount() + 1;
        }
        int emitCount = chunks.size() - carry;
        emit(chunks.subList(0, emitCount), sink, tracker);

        buffer.setLength(0);
        for (TextChunk carried : chunks.subList(emitCount, chunks.size())) {
            if (buffer.length() > 0) {
                buffer.append(' ');
            }
            buffer.append(carried.text());
        }
        if (trailingSpace) {
            buffer.append(' ');
        }
    }

    private void emitAll(ChunkSink sink, ProgressTracker tracker) throws InterruptedException {
        List<TextChunk> chunks = segment();
        buffer.setLength(0);
        emit(chunks, sink, tracker);
    }

    private List<TextChunk> segment() {
        return segmenter.segment(buffer.toString(), settings.minChunkSize(), settings.maxChunkSize(),
                settings.protectedPatterns(), nextIndex);
    }

    private void emit(List<TextChunk> chunks, ChunkSink sink, ProgressTracker tracker) throws InterruptedException {
        for (TextChunk chunk : chunks) {
            sink.accept(chunk);
            nextIndex = chunk.index() + 1;
            emittedChars += chunk.charCount();
            tracker.chunkFetched(chunk);
            LOG.debug("Emitted chunk {} ({} chars)", chunk.index(), chunk.charCount());
        }
    }

    private int estimateTotal(OptionalLong expectedLength) {
        double averageChunk = nextIndex > 0
                ? (double) emittedChars / nextIndex
                : (settings.minChunkSize() + settings.maxChunkSize()) / 2.0;
        long pendingChars = buffer.length();
        if (expectedLength.isPresent()) {
            pendingChars += Math.max(0L, expectedLength.getAsLong() - consumed);
        }
        return nextIndex + (int) Math.ceil(pendingChars / averageChunk);
    }
}
