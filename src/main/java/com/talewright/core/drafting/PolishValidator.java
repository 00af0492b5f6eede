package com.talewright.core.drafting;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Guards against a polish pass that loses or replaces content.
 * <p>
 * A polished text is rejected when it is much shorter than the draft, when its ending no longer
 * corresponds to the draft's ending, or when it contains an editorial note instead of prose.
 */
@Component
public class PolishValidator {

    public enum Reason {
        CHUNK_LOSS,
        TRUNCATED_ENDING,
        META_NOTE
    }

    /**
     * @param reason why the polish was rejected, {@code null} when valid
     * @param detail human-readable explanation
     */
    public record Result(Reason reason, String detail) {
        public boolean valid() {
            return reason == null;
        }

        static Result ok() {
            return new Result(null, "ok");
        }
    }

    private static final List<Pattern> META_PATTERNS = List.of(
            Pattern.compile("(?im)^\\s*\\(?\\s*(?:note|editor'?s note|author'?s note|n\\.b\\.)\\s*:"),
            Pattern.compile("(?i)\\bas an ai\\b"),
            Pattern.compile("(?i)\\bhere is the (?:polished|revised|refined|edited)\\b"),
            Pattern.compile("(?i)\\bi(?: have|'ve) (?:polished|revised|refined|edited|made)\\b"),
            Pattern.compile("\\[\\s*(?:\\.\\.\\.|…)\\s*]"),
            Pattern.compile("(?i)\\(\\s*(?:the )?rest of (?:the )?(?:scene|text|chapter) (?:remains )?unchanged\\s*\\)"),
            Pattern.compile("(?i)\\b(?:remainder|rest) of the (?:scene|text) (?:remains|is) (?:the same|unchanged)\\b"),
            Pattern.compile("(?i)\\[\\s*continue[sd]? (?:as|from) (?:before|original)\\s*]"));

    private final PolishProperties properties;

    public PolishValidator(PolishProperties properties) {
        this.properties = properties;
    }

    public Result validate(String draft, String polished) {
        if (polished == null || polished.isBlank()) {
            return new Result(Reason.CHUNK_LOSS, "polished text is empty");
        }
        for (Pattern pattern : META_PATTERNS) {
            if (pattern.matcher(polished).find() && !pattern.matcher(draft).find()) {
                return new Result(Reason.META_NOTE, "contains editorial note matching " + pattern.pattern());
            }
        }

        int draftWords = ProseText.wordCount(draft);
        int polishedWords = ProseText.wordCount(polished);
        if (draftWords > 0 && polishedWords < draftWords * properties.getMinLengthRatio()) {
            return new Result(Reason.CHUNK_LOSS,
                    "polished " + polishedWords + " words vs draft " + draftWords);
        }

        if (endsWithTerminal(draft) && !endsWithTerminal(polished)) {
            return new Result(Reason.TRUNCATED_ENDING, "polished text stops mid-sentence");
        }
        double overlap = endingOverlap(draft, polished, properties.getEndingWindowWords());
        if (overlap < properties.getMinEndingOverlap()) {
            return new Result(Reason.TRUNCATED_ENDING,
                    String.format(Locale.ROOT, "ending overlap %.2f below %.2f", overlap, properties.getMinEndingOverlap()));
        }
        return Result.ok();
    }

    static boolean endsWithTerminal(String text) {
        String t = text.stripTrailing();
        if (t.isEmpty()) {
            return false;
        }
        char last = t.charAt(t.length() - 1);
        return ".!?\"'”’…*)—-".indexOf(last) >= 0;
    }

    /**
     * Fraction of the distinct words in the draft's last {@code window} words that also appear in
     * the polished text's last {@code window} words.
     */
    static double endingOverlap(String draft, String polished, int window) {
        Set<String> draftEnd = lastWords(draft, window);
        if (draftEnd.isEmpty()) {
            return 1.0;
        }
        Set<String> polishedEnd = lastWords(polished, window);
        long shared = draftEnd.stream().filter(polishedEnd::contains).count();
        return (double) shared / draftEnd.size();
    }

    private static Set<String> lastWords(String text, int window) {
        String[] words = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}']+");
        List<String> all = Arrays.stream(words).filter(w -> w.length() > 2).toList();
        return new HashSet<>(all.subList(Math.max(0, all.size() - window), all.size()));
    }
}
