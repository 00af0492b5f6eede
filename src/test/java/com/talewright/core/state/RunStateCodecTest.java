package com.talewright.core.state;

import com.talewright.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunStateCodecTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:15:30.123456789Z");

    private final RunStateCodec codec = new RunStateCodec();

    static RunState sampleState() {
        RunState state = RunState.create("TLWR-2026-0001-abcd", "P-1", "A lighthouse keeper hears the sea speak",
                new ModelConfig("gpt-test", 0.7), T0);
        state.setPhase(Phase.DRAFTING);
        state.setOutline(List.of(
                new SceneOutline(1, "Storm", "The lamp fails", List.of("Mara Vell"), 1200),
                new SceneOutline(2, "Calm", "The sea answers", List.of(), 900)));
        state.setTotalScenes(2);
        state.setCurrentScene(2);
        state.putArtifact("narrative", Map.of("genre", "gothic", "themes", List.of("grief", "duty"), "scenes", 2));
        state.addCharacterName("Mara Vell");
        state.putDraft(new SceneDraft(1, "The storm broke.", 3, 2, DraftStatus.FINAL, true, true, T0));
        state.addCritique(1, new Critique(6.5, true, List.of("mood"), List.of("pacing"), List.of("tighten"), "close"));
        state.incrementRevisions(1);
        state.appendConstraint(Constraint.seed("world_genre", "gothic", "concept", T0));
        state.appendConstraint(new Constraint("char_mara_vell_status", "wounded", AgentRole.ARCHIVIST, 1, T0, "", false));
        state.appendRawFacts(List.of(new RawFact("char_mara_vell_status", "wounded", "Mara was wounded",
                AgentRole.WRITER, 1, T0)));
        state.setLastArchivistScene(1);
        state.appendMessage(new AgentMessage(AgentRole.CRITIC, AgentRole.WRITER, MessageType.REVISION_REQUEST,
                "tighten", Map.of("score", 6.5), Phase.DRAFTING, 1, T0));
        state.setPaused(true);
        state.setUpdatedAt(T0.plusSeconds(60));
        return state;
    }

    @Test
    @DisplayName("round-trips a populated state without loss")
    void roundTrip() {
        RunState state = sampleState();

        RunState restored = codec.fromJson(codec.toJson(state));

        assertEquals(state, restored);
        assertEquals(SceneDraft.class, restored.getDrafts().get(1).getClass());
        assertEquals(RunStatus.PAUSED, restored.status());
    }

    @Test
    @DisplayName("copy is deep: mutating the copy leaves the original alone")
    void copyIsDeep() {
        RunState state = sampleState();
        RunState copy = codec.copy(state);

        copy.incrementRevisions(1);
        copy.addCharacterName("Tobin");
        copy.setPhase(Phase.POLISH);

        assertEquals(1, state.revisionsFor(1));
        assertEquals(List.of("Mara Vell"), state.getCharacterNames());
        assertEquals(Phase.DRAFTING, state.getPhase());
    }

    @Test
    @DisplayName("snapshot carries the last event id")
    void snapshotRoundTrip() {
        RunSnapshot snapshot = new RunSnapshot(sampleState(), 42, T0);

        RunSnapshot restored = codec.snapshotFromJson(codec.snapshotToJson(snapshot));

        assertEquals(42, restored.lastEventId());
        assertEquals(T0, restored.savedAt());
        assertEquals(snapshot.state(), restored.state());
    }

    @Test
    @DisplayName("malformed JSON surfaces as IllegalStateException")
    void malformedJson() {
        assertThrows(IllegalStateException.class, () -> codec.fromJson("{not json"));
    }
}
