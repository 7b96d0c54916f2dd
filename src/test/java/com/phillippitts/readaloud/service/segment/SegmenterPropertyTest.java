package com.phillippitts.readaloud.service.segment;

import com.phillippitts.readaloud.domain.TextChunk;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the segmenter over generated documents and checks the properties every output must have.
 */
class SegmenterPropertyTest {

    private static final String[] WORDS = {
            "alpha", "beta", "gamma", "river", "stone", "light", "quiet", "house", "garden",
            "Lee", "Madrid", "Ana", "Dr.", "U.S.", "Sra.", "e.g.", "etc.", "y", "and", "pero",
    };
    private static final String[] GAPS = {" ", " ", " ", "  ", "\n", "\t", " \n "};
    private static final String TERMINATORS = ".!?";
    private static final int RUNS = 300;

    private final Segmenter segmenter = new Segmenter();
    private final ProtectedPatterns patterns = ProtectedPatterns.defaults();

    @Test
    void shouldReconstructNormalizedInput() {
        for (int seed = 0; seed < RUNS; seed++) {
            Random random = new Random(seed);
            String text = document(random);
            int min = 10 + random.nextInt(30);
            int max = min + 12 + random.nextInt(60);

            List<TextChunk> chunks = segmenter.segment(text, min, max, patterns, 0);

            assertThat(join(chunks))
                    .as("seed %d", seed)
                    .isEqualTo(Segmenter.normalizeWhitespace(text));
        }
    }

    @Test
    void shouldKeepChunksInsideSizeBand() {
        for (int seed = 0; seed < RUNS; seed++) {
            Random random = new Random(seed);
            String text = document(random);
            int min = 10 + random.nextInt(30);
            int max = min + 12 + random.nextInt(60);

            List<TextChunk> chunks = segmenter.segment(text, min, max, patterns, 0);

            for (int i = 0; i < chunks.size(); i++) {
                TextChunk chunk = chunks.get(i);
                assertThat(chunk.charCount()).as("seed %d chunk %d", seed, i).isLessThanOrEqualTo(max);
                if (i < chunks.size() - 1) {
                    assertThat(chunk.charCount()).as("seed %d chunk %d", seed, i).isGreaterThanOrEqualTo(min);
                }
                assertThat(chunk.index()).isEqualTo(i);
                assertThat(chunk.text()).isEqualTo(chunk.text().strip());
            }
        }
    }

    @Test
    void shouldNeverEndSentenceInsideProtectedToken() {
        for (int seed = 0; seed < RUNS; seed++) {
            String text = Segmenter.normalizeWhitespace(document(new Random(seed)));

            List<Integer> ends = segmenter.sentenceEnds(text, patterns);

            assertThat(ends).isSorted().endsWith(text.length());
            for (int end : ends.subList(0, ends.size() - 1)) {
                assertThat(patterns.covers(text, end - 1))
                        .as("seed %d boundary %d in '%s'", seed, end, text)
                        .isFalse();
            }
        }
    }

    @Test
    void shouldBeDeterministic() {
        for (int seed = 0; seed < 50; seed++) {
            String text = document(new Random(seed));

            assertThat(segmenter.segment(text, 15, 60, patterns, 0))
                    .isEqualTo(segmenter.segment(text, 15, 60, patterns, 0));
        }
    }

    private static String document(Random random) {
        StringBuilder sb = new StringBuilder();
        int sentences = 1 + random.nextInt(12);
        for (int s = 0; s < sentences; s++) {
            int words = 1 + random.nextInt(14);
            for (int w = 0; w < words; w++) {
                String word = WORDS[random.nextInt(WORDS.length)];
                if (w == 0) {
                    word = Character.toUpperCase(word.charAt(0)) + word.substring(1);
                } else if (random.nextInt(8) == 0) {
                    word = word + ",";
                }
                sb.append(word).append(GAPS[random.nextInt(GAPS.length)]);
            }
            while (Character.isWhitespace(sb.charAt(sb.length() - 1))) {
                sb.setLength(sb.length() - 1);
            }
            sb.append(TERMINATORS.charAt(random.nextInt(TERMINATORS.length())));
            sb.append(GAPS[random.nextInt(GAPS.length)]);
        }
        return sb.toString();
    }

    private static String join(List<TextChunk> chunks) {
        return chunks.stream().map(TextChunk::text).collect(Collectors.joining(" "));
    }
}
