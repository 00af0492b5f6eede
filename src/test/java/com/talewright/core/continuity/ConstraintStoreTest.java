package com.talewright.core.continuity;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.talewright.core.model.AgentRole;
import com.talewright.core.model.Constraint;
import com.talewright.core.model.ModelConfig;
import com.talewright.core.state.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private RunState state;
    private ConstraintStore store;

    @BeforeEach
    void setUp() {
        state = RunState.create("R-1", "P-1", "A lighthouse keeper hears the sea speak", ModelConfig.of("test"), NOW);
        store = new ConstraintStore(state);
    }

    private static Constraint fact(String key, String value, int scene) {
        return new Constraint(key, value, AgentRole.ARCHIVIST, scene, NOW, "observed", false);
    }

    @Nested
    @DisplayName("seed")
    class SeedTests {

        @Test
        @DisplayName("anchors seeds at scene 0 and skips blank values")
        void anchorsSeeds() {
            int added = store.seed(List.of(
                    Constraint.seed("world_genre", "gothic", "concept", NOW),
                    Constraint.seed("world_tone", " ", "concept", NOW)));

            assertEquals(1, added);
            Constraint genre = store.current("world_genre").orElseThrow();
            assertTrue(genre.anchored());
            assertEquals(0, genre.sceneNumber());
        }

        @Test
        @DisplayName("does not re-anchor a key that is already anchored")
        void doesNotReanchor() {
            store.seed(List.of(Constraint.seed("world_genre", "gothic", "concept", NOW)));
            int added = store.seed(List.of(Constraint.seed("world_genre", "comedy", "concept", NOW)));

            assertEquals(0, added);
            assertEquals("gothic", store.current("world_genre").orElseThrow().value());
        }
    }

    @Nested
    @DisplayName("consolidate")
    class ConsolidateTests {

        @Test
        @DisplayName("never supersedes an anchored key")
        void anchoredKeyWins() {
            store.seed(List.of(Constraint.seed("world_genre", "gothic", "concept", NOW)));

            ConsolidationResult result = store.consolidate(
                    List.of(fact("world_genre", "space opera", 4)), key -> true);

            assertTrue(result.accepted().isEmpty());
            assertEquals(1, result.rejected().size());
            assertEquals("gothic", store.current("world_genre").orElseThrow().value());
        }

        @Test
        @DisplayName("later scene supersedes earlier scene for the same key")
        void lastWriterWinsByScene() {
            store.consolidate(List.of(fact("char_mara_status", "wounded", 2)), key -> true);
            store.consolidate(List.of(fact("char_mara_status", "healed", 5)), key -> true);

            assertEquals("healed", store.current("char_mara_status").orElseThrow().value());
            assertEquals(2, state.getKeyConstraints().size());
        }

        @Test
        @DisplayName("rejects a candidate older than the current value")
        void rejectsStaleCandidate() {
            store.consolidate(List.of(fact("char_mara_location", "Harbor", 5)), key -> true);

            ConsolidationResult result = store.consolidate(
                    List.of(fact("char_mara_location", "Tower", 3)), key -> true);

            assertEquals(1, result.rejected().size());
            assertEquals("Harbor", store.current("char_mara_location").orElseThrow().value());
        }

        @Test
        @DisplayName("skips a candidate repeating the current value")
        void skipsUnchangedValue() {
            store.consolidate(List.of(fact("char_mara_status", "wounded", 2)), key -> true);
            ConsolidationResult result = store.consolidate(List.of(fact("char_mara_status", "wounded", 3)), key -> true);

            assertTrue(result.accepted().isEmpty());
            assertTrue(result.rejected().isEmpty());
            assertEquals(1, state.getKeyConstraints().size());
        }

        @Test
        @DisplayName("rejects keys the admission filter refuses")
        void rejectsInadmissibleKeys() {
            ConsolidationResult result = store.consolidate(
                    List.of(fact("char_ghost_status", "dead", 1), fact("char_mara_status", "alive", 1)),
                    key -> key.startsWith("char_mara_"));

            assertEquals(1, result.accepted().size());
            assertEquals("char_ghost_status", result.rejected().get(0).key());
        }

        @Test
        @DisplayName("later scene facts are stored as mutable and the downgrade is logged")
        void storesMutable() {
            Logger logger = (Logger) LoggerFactory.getLogger(ConstraintStore.class);
            Level previous = logger.getLevel();
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
            logger.setLevel(Level.DEBUG);
            try {
                ConsolidationResult result = store.consolidate(List.of(
                        new Constraint("plot_secret", "revealed", AgentRole.ARCHIVIST, 3, NOW, "", true)),
                        key -> true);

                assertFalse(result.accepted().get(0).immutable());
                assertFalse(store.current("plot_secret").orElseThrow().immutable());
                assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.DEBUG
                        && e.getFormattedMessage().contains("plot_secret")));
            } finally {
                logger.detachAppender(appender);
                logger.setLevel(previous);
            }
        }
    }

    @Nested
    @DisplayName("render")
    class RenderTests {

        @Test
        @DisplayName("empty store renders the placeholder")
        void emptyBlock() {
            assertEquals(ConstraintStore.EMPTY_BLOCK, store.renderBlock());
        }

        @Test
        @DisplayName("lists anchored facts before the current state")
        void anchoredFirst() {
            store.consolidate(List.of(fact("char_mara_status", "wounded", 2)), key -> true);
            store.seed(List.of(Constraint.seed("world_genre", "gothic", "concept", NOW)));

            String block = store.renderBlock();

            assertTrue(block.startsWith("ESTABLISHED FACTS (never contradict):\n- world_genre: gothic"));
            assertTrue(block.contains("CURRENT STATE:\n- char_mara_status: wounded (Scene 2)"));
        }
    }
}
