package com.talewright.core.drafting;

import java.util.regex.Pattern;

/**
 * Text operations on generated prose: overlap removal when stitching continuations, removal of
 * self-reported word counts, and word counting.
 */
public final class ProseText {

    private ProseText() {}

    /** Shortest echo treated as overlap; shorter coincidences (a shared word ending) are kept. */
    public static final int DEFAULT_MIN_OVERLAP = 16;

    /** Longest suffix of the existing text examined for an echo. */
    public static final int DEFAULT_OVERLAP_WINDOW = 4000;

    private static final Pattern WORD = Pattern.compile("\\S+");

    private static final Pattern WORD_COUNT_CLAIM = Pattern.compile(
            "(?im)^[ \\t]*[\\[(*_]*\\s*(?:approximate\\s+|approx\\.?\\s+|total\\s+)?word\\s*count\\s*[:\\-]?\\s*~?"
                    + "[\\d,.]+\\s*(?:words)?\\s*[\\])*_]*[ \\t]*$\\R?"
                    + "|(?i)[\\[(]\\s*(?:approximately\\s+|about\\s+|~)?[\\d,]+\\s+words\\s*[\\])]");

    /**
     * Removes from {@code continuation} any prefix that repeats the end of {@code existing}.
     * <p>
     * The longest suffix of {@code existing} (within the window) that is also a prefix of
     * {@code continuation} and at least {@code minOverlap} characters long is cut; the check
     * repeats until no such overlap remains, so applying the function twice equals applying it
     * once. Without an overlap the continuation is returned unchanged.
     */
    public static String stripOverlap(String existing, String continuation, int minOverlap, int window) {
        if (existing == null || continuation == null || existing.isEmpty() || continuation.isEmpty()) {
            return continuation;
        }
        String tail = existing.length() > window ? existing.substring(existing.length() - window) : existing;
        String result = continuation;
        int overlap;
        while ((overlap = longestOverlap(tail, result, minOverlap)) > 0) {
            result = result.substring(overlap);
        }
        return result;
    }

    public static String stripOverlap(String existing, String continuation) {
        return stripOverlap(existing, continuation, DEFAULT_MIN_OVERLAP, DEFAULT_OVERLAP_WINDOW);
    }

    private static int longestOverlap(String tail, String next, int minOverlap) {
        int max = Math.min(tail.length(), next.length());
        for (int len = max; len >= Math.max(1, minOverlap); len--) {
            if (tail.regionMatches(tail.length() - len, next, 0, len)) {
                return len;
            }
        }
        return 0;
    }

    /**
     * Joins a continuation onto existing text with a paragraph break, after removing any echoed overlap.
     */
    public static String append(String existing, String continuation, int minOverlap, int window) {
        String fresh = stripOverlap(existing, continuation, minOverlap, window).strip();
        if (fresh.isEmpty()) {
            return existing;
        }
        if (existing == null || existing.isBlank()) {
            return fresh;
        }
        return existing.stripTrailing() + "\n\n" + fresh;
    }

    /**
     * Removes lines and bracketed notes in which the model reports its own word count.
     */
    public static String stripWordCountClaims(String text) {
        if (text == null) {
            return "";
        }
        return WORD_COUNT_CLAIM.matcher(text).replaceAll("").strip();
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int count = 0;
        var matcher = WORD.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /** Last {@code maxChars} characters of the text, starting at a word boundary when possible. */
    public static String tail(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text == null ? "" : text;
        }
        String cut = text.substring(text.length() - maxChars);
        int space = cut.indexOf(' ');
        return space > 0 && space < 40 ? cut.substring(space + 1) : cut;
    }
}
