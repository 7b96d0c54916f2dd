package com.phillippitts.readaloud.util;

/** Utility for privacy-safe logging of text previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short preview of chunk text for debug logs: the first {@code max} characters followed by the
     * total length, e.g. {@code "The U.S. eco…" (22 chars)}.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "\"\" (0 chars)";
        }
        String head = truncate(s, max);
        String ellipsis = head.length() < s.length() ? "…" : "";
        return "\"" + head + ellipsis + "\" (" + s.length() + " chars)";
    }
}
