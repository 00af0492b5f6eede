package com.talewright.core.drafting;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProseTextTest {

    private static final String EXISTING = "The tide came in slowly. Mara lit the lamp and watched the dark water rise.";

    @Nested
    @DisplayName("stripOverlap")
    class StripOverlapTests {

        @Test
        @DisplayName("cuts a continuation prefix that echoes the end of the existing text")
        void cutsEcho() {
            String continuation = "watched the dark water rise. Then the bell rang.";

            assertEquals(" Then the bell rang.", ProseText.stripOverlap(EXISTING, continuation));
        }

        @Test
        @DisplayName("is idempotent")
        void idempotent() {
            String continuation = "the dark water rise. Then the bell rang.";
            String once = ProseText.stripOverlap(EXISTING, continuation);

            assertEquals(once, ProseText.stripOverlap(EXISTING, once));
        }

        @Test
        @DisplayName("returns the continuation unchanged without overlap")
        void passthrough() {
            String continuation = "Far away, a ship answered with its horn.";

            assertEquals(continuation, ProseText.stripOverlap(EXISTING, continuation));
        }

        @Test
        @DisplayName("keeps short coincidental overlaps")
        void keepsShortCoincidence() {
            String continuation = "rise. Another day began.";

            assertEquals(continuation, ProseText.stripOverlap(EXISTING, continuation));
        }
    }

    @Nested
    @DisplayName("append")
    class AppendTests {

        @Test
        @DisplayName("joins with a paragraph break after removing the echo")
        void joinsWithBreak() {
            String joined = ProseText.append(EXISTING, "watched the dark water rise. Then the bell rang.",
                    ProseText.DEFAULT_MIN_OVERLAP, ProseText.DEFAULT_OVERLAP_WINDOW);

            assertEquals(EXISTING + "\n\nThen the bell rang.", joined);
        }

        @Test
        @DisplayName("keeps existing text when the continuation is pure echo")
        void pureEcho() {
            String joined = ProseText.append(EXISTING, "Mara lit the lamp and watched the dark water rise.",
                    ProseText.DEFAULT_MIN_OVERLAP, ProseText.DEFAULT_OVERLAP_WINDOW);

            assertEquals(EXISTING, joined);
        }

        @Test
        @DisplayName("starts from the continuation when nothing exists yet")
        void emptyExisting() {
            assertEquals("First words.", ProseText.append("", "  First words.  ", 16, 4000));
        }
    }

    @Test
    @DisplayName("removes self-reported word counts")
    void stripsWordCountClaims() {
        String text = "The lamp guttered.\nWord count: 1,245\nShe waited. (approximately 300 words)";

        String cleaned = ProseText.stripWordCountClaims(text);

        assertFalse(cleaned.toLowerCase().contains("word count"));
        assertFalse(cleaned.contains("300 words"));
        assertTrue(cleaned.startsWith("The lamp guttered."));
        assertTrue(cleaned.contains("She waited."));
    }

    @Test
    @DisplayName("counts whitespace-separated words")
    void countsWords() {
        assertEquals(0, ProseText.wordCount("  "));
        assertEquals(0, ProseText.wordCount(null));
        assertEquals(5, ProseText.wordCount("one two\nthree  four\tfive"));
    }

    @Test
    @DisplayName("tail starts at a word boundary")
    void tailAtWordBoundary() {
        String tail = ProseText.tail(EXISTING, 20);

        assertTrue(EXISTING.endsWith(tail));
        assertFalse(tail.startsWith(" "));
        assertEquals(EXISTING, ProseText.tail(EXISTING, 500));
    }
}
