package com.phillippitts.readaloud.service.segment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Table of tokens (abbreviations, initialisms, time markers) inside which no sentence boundary or
 * word-level split may be placed.
 *
 * <p>Matching is case-sensitive substring matching: a position is protected when some occurrence
 * of a listed token covers it.
 */
public final class ProtectedPatterns {

    /**
     * Default table: English and Spanish honorifics, degrees, country initialisms, Latin
     * abbreviations and time markers.
     */
    public static final List<String> DEFAULT_PATTERNS = List.of(
            "Mr.", "Mrs.", "Ms.", "Dr.", "Prof.", "Sr.", "Jr.", "St.",
            "Sra.", "Srta.", "Dra.", "Lic.", "Ing.",
            "Ph.D.", "M.D.", "B.A.", "M.A.", "B.S.", "M.S.",
            "U.S.A.", "U.S.", "U.K.", "E.U.", "EE.UU.",
            "etc.", "vs.", "i.e.", "e.g.", "approx.", "Inc.", "Ltd.",
            "A.M.", "P.M.", "a.m.", "p.m."
    );

    private final List<String> patterns;
    private final int longest;

    private ProtectedPatterns(List<String> patterns) {
        this.patterns = patterns;
        this.longest = patterns.stream().mapToInt(String::length).max().orElse(0);
    }

    /**
     * Builds a table from raw tokens. Blank entries are dropped and internal whitespace is
     * collapsed so tokens match whitespace-normalized text.
     *
     * @param tokens protected tokens
     * @return pattern table
     */
    public static ProtectedPatterns of(Collection<String> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        List<String> cleaned = new ArrayList<>();
        for (String token : tokens) {
            if (token == null) {
                continue;
            }
            String normalized = Segmenter.normalizeWhitespace(token);
            if (!normalized.isEmpty() && !cleaned.contains(normalized)) {
                cleaned.add(normalized);
            }
        }
        return new ProtectedPatterns(List.copyOf(cleaned));
    }

    public static ProtectedPatterns defaults() {
        return of(DEFAULT_PATTERNS);
    }

    /**
     * @param text     whitespace-normalized text
     * @param position character index in {@code text}
     * @return whether an occurrence of a protected token covers {@code position}
     */
    public boolean covers(String text, int position) {
        for (String pattern : patterns) {
            int from = Math.max(0, position - pattern.length() + 1);
            for (int start = from; start <= position; start++) {
                if (text.startsWith(pattern, start)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @return length of the longest protected token, 0 for an empty table
     */
    public int longestLength() {
        return longest;
    }

    public List<String> asList() {
        return patterns;
    }
}
