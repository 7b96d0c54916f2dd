package com.phillippitts.readaloud.service.segment;

import com.phillippitts.readaloud.domain.TextChunk;
import com.phillippitts.readaloud.exception.SegmentationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits text into ordered chunks sized for one synthesis call each.
 *
 * <p>Algorithm (deterministic, operating on whitespace-normalized text):
 * <ol>
 *   <li>Sentence boundaries are found after runs of {@code . ! ?} (plus closing quotes or
 *       brackets) followed by a space and a sentence start (uppercase letter, {@code ¡}, {@code ¿},
 *       or an opening quote before one), or by the end of the text. A boundary whose punctuation
 *       lies inside a {@link ProtectedPatterns protected token} is ignored.</li>
 *   <li>Sentences are appended greedily to the current chunk while it stays within
 *       {@code maxSize}. When the next sentence does not fit, the chunk is closed if it has at
 *       least {@code minSize} characters; otherwise accumulation continues and the chunk is
 *       force-closed inside the {@code [minSize, maxSize]} window, preferring a comma followed by a
 *       coordinating conjunction, then any comma, semicolon or colon, then the last space.</li>
 *   <li>If no space exists inside that window (a word longer than the band allows) the forced
 *       cut fails with a {@link SegmentationException}. Only that stretch is recovered: the chunk
 *       is closed just before the long word, which then becomes a chunk of its own. Words are never
 *       split, so such a word may be an oversized chunk. Sentence-aware splitting resumes after
 *       it.</li>
 * </ol>
 *
 * <p>Joining the chunk texts with single spaces reproduces the normalized input exactly.
 */
@Component
public class Segmenter {

    private static final Logger LOG = LogManager.getLogger(Segmenter.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final String TERMINATORS = ".!?";
    private static final String CLOSERS = "\"'”’)]»";
    private static final String OPENERS = "\"'“‘([«";

    /** English and Spanish coordinating conjunctions that may follow a clause-level comma. */
    static final Set<String> CONJUNCTIONS = Set.of(
            "and", "but", "or", "so", "yet", "nor", "for",
            "y", "e", "pero", "o", "u", "ni", "sino");

    /**
     * Collapses every whitespace run to a single space and trims the result.
     *
     * @param text input text (may be null)
     * @return normalized text, empty for null
     */
    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Segments text into chunks indexed from 0.
     *
     * @see #segment(String, int, int, Set, int)
     */
    public List<TextChunk> segment(String text, int minSize, int maxSize, Set<String> protectedPatterns) {
        return segment(text, minSize, maxSize, protectedPatterns, 0);
    }

    /**
     * Segments text into chunks whose indices start at {@code firstIndex}.
     *
     * @param text              text to segment (whitespace is normalized first)
     * @param minSize           smallest chunk the segmenter closes on its own
     * @param maxSize           largest chunk for splittable text
     * @param protectedPatterns tokens inside which no boundary is placed
     * @param firstIndex        index of the first emitted chunk
     * @return ordered chunks; empty when the text has no visible characters
     * @throws IllegalArgumentException if the size band is invalid
     */
    public List<TextChunk> segment(String text, int minSize, int maxSize,
                                   Set<String> protectedPatterns, int firstIndex) {
        Objects.requireNonNull(protectedPatterns, "protectedPatterns must not be null");
        return segment(text, minSize, maxSize, ProtectedPatterns.of(protectedPatterns), firstIndex);
    }

    /**
     * Segments text against a prepared pattern table; used by callers that segment repeatedly.
     */
    public List<TextChunk> segment(String text, int minSize, int maxSize,
                                   ProtectedPatterns patterns, int firstIndex) {
        if (minSize <= 0 || maxSize < minSize) {
            throw new IllegalArgumentException(
                    "Invalid chunk size band [" + minSize + ", " + maxSize + "]");
        }
        if (firstIndex < 0) {
            throw new IllegalArgumentException("firstIndex must not be negative, got: " + firstIndex);
        }
        String normalized = normalizeWhitespace(text);
        if (normalized.isEmpty()) {
            return List.of();
        }

        List<String> pieces = sentenceAwareSplit(normalized, minSize, maxSize, patterns);
        List<TextChunk> chunks = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            chunks.add(new TextChunk(firstIndex + chunks.size(), piece));
        }
        LOG.debug("Segmented {} chars into {} chunks (band [{}, {}])",
                normalized.length(), chunks.size(), minSize, maxSize);
        return chunks;
    }

    private List<String> sentenceAwareSplit(String text, int minSize, int maxSize, ProtectedPatterns patterns) {
        List<String> out = new ArrayList<>();
        int start = 0;
        int end = 0;
        int sentenceStart = 0;
        for (int sentenceEnd : sentenceEnds(text, patterns)) {
            if (end == start) {
                end = sentenceEnd;
            } else if (sentenceEnd - start <= maxSize) {
                end = sentenceEnd;
            } else if (end - start >= minSize) {
                out.add(text.substring(start, end));
                start = sentenceStart;
                end = sentenceEnd;
            } else {
                end = sentenceEnd;
            }
            while (end - start > maxSize) {
                int cut;
                try {
                    cut = forcedCut(text, start, end, minSize, maxSize, patterns);
                } catch (SegmentationException e) {
                    LOG.warn("{}; giving the long word a chunk of its own", e.getMessage());
                    cut = cutAroundLongWord(text, start, end, minSize, patterns);
                }
                out.add(text.substring(start, cut));
                start = cut + 1;
            }
            sentenceStart = sentenceEnd + 1;
        }
        if (end > start) {
            out.add(text.substring(start, end));
        }
        return out;
    }

    /**
     * Finds the end offsets (exclusive) of all sentences. The last offset is always the text length.
     */
    List<Integer> sentenceEnds(String text, ProtectedPatterns patterns) {
        List<Integer> ends = new ArrayList<>();
        int length = text.length();
        int i = 0;
        while (i < length) {
            if (TERMINATORS.indexOf(text.charAt(i)) < 0) {
                i++;
                continue;
            }
            int runStart = i;
            while (i < length && TERMINATORS.indexOf(text.charAt(i)) >= 0) {
                i++;
            }
            int runEnd = i;
            while (i < length && CLOSERS.indexOf(text.charAt(i)) >= 0) {
                i++;
            }
            boolean followedByStart = i < length && text.charAt(i) == ' ' && startsSentence(text, i + 1);
            if (i < length && !followedByStart) {
                continue;
            }
            if (isProtected(text, runStart, runEnd, patterns)) {
                continue;
            }
            if (i < length) {
                ends.add(i);
            }
        }
        ends.add(length);
        return ends;
    }

    private static boolean startsSentence(String text, int pos) {
        if (pos >= text.length()) {
            return false;
        }
        char c = text.charAt(pos);
        if (isSentenceInitial(c)) {
            return true;
        }
        return OPENERS.indexOf(c) >= 0 && pos + 1 < text.length() && isSentenceInitial(text.charAt(pos + 1));
    }

    private static boolean isSentenceInitial(char c) {
        return Character.isUpperCase(c) || c == '¡' || c == '¿';
    }

    private static boolean isProtected(String text, int from, int to, ProtectedPatterns patterns) {
        for (int p = from; p < to; p++) {
            if (patterns.covers(text, p)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Picks the space at which to force-close the chunk starting at {@code start}. The returned
     * offset is a space inside {@code (start + minSize .. start + maxSize)} that is not covered by a
     * protected token.
     */
    private int forcedCut(String text, int start, int end, int minSize, int maxSize, ProtectedPatterns patterns) {
        int lo = start + minSize;
        int hi = Math.min(start + maxSize, end - 1);

        int clause = -1;
        int natural = -1;
        int word = -1;
        for (int q = hi; q >= lo; q--) {
            if (text.charAt(q) != ' ' || patterns.covers(text, q)) {
                continue;
            }
            if (word < 0) {
                word = q;
            }
            char before = text.charAt(q - 1);
            if (natural < 0 && (before == ',' || before == ';' || before == ':')) {
                natural = q;
            }
            if (before == ',' && followedByConjunction(text, q + 1)) {
                clause = q;
                break;
            }
        }
        if (clause >= 0) {
            return clause;
        }
        if (natural >= 0) {
            return natural;
        }
        if (word >= 0) {
            return word;
        }
        throw new SegmentationException(
                "No word boundary within chunk size band [" + minSize + ", " + maxSize + "]", start);
    }

    private static boolean followedByConjunction(String text, int from) {
        int to = text.indexOf(' ', from);
        if (to < 0) {
            return false;
        }
        return CONJUNCTIONS.contains(text.substring(from, to).toLowerCase(Locale.ROOT));
    }

    /**
     * Cut used when the size window holds no usable space: the last space before the window, so
     * the long word starts the next chunk, or else the first space after it, so the word forms a
     * chunk of its own. Returns {@code end} when the rest of the stretch has no space at all.
     */
    private static int cutAroundLongWord(String text, int start, int end, int minSize, ProtectedPatterns patterns) {
        for (int q = Math.min(start + minSize, end) - 1; q > start; q--) {
            if (text.charAt(q) == ' ' && !patterns.covers(text, q)) {
                return q;
            }
        }
        for (int q = start + minSize; q < end; q++) {
            if (text.charAt(q) == ' ' && !patterns.covers(text, q)) {
                return q;
            }
        }
        return end;
    }
}
