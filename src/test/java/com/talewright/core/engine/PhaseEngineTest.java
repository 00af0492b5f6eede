package com.talewright.core.engine;

import com.talewright.core.events.EventTypes;
import com.talewright.core.events.RunEvent;
import com.talewright.core.llm.TextGenerator;
import com.talewright.core.model.AgentRole;
import com.talewright.core.model.ModelConfig;
import com.talewright.core.model.Phase;
import com.talewright.core.model.RunStatus;
import com.talewright.core.persistence.InMemoryArtifactStore;
import com.talewright.core.state.RunState;
import com.talewright.core.support.ScriptedStoryGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs whole executions through the phase graph against a scripted generator.
 */
class PhaseEngineTest {

    private static RunHandle register(EngineFixture fixture, String runId, Phase phase) {
        RunState state = RunState.create(runId, "P-1", "A keeper hears the sea speak",
                ModelConfig.of("test-model"), Instant.now());
        state.setPhase(phase);
        return fixture.registry.create(state, fixture.codec.toJson(state));
    }

    private static List<String> types(EngineFixture fixture, String runId, String type) {
        return fixture.eventBus.read(runId, 0).stream()
                .filter(e -> e.type().equals(type))
                .map(e -> String.valueOf(e.data().get("phase")))
                .toList();
    }

    @Test
    @DisplayName("a fresh run walks all twelve phases and assembles the manuscript")
    void completesAllPhases() throws Exception {
        ScriptedStoryGenerator generator = new ScriptedStoryGenerator(2).rejectScene(2);
        EngineFixture fixture = new EngineFixture(generator, new InMemoryArtifactStore());
        RunHandle handle = register(fixture, "R-full", Phase.CONCEPT);

        RunStatus status = fixture.engine.execute(handle);

        assertEquals(RunStatus.COMPLETED, status);
        RunState state = handle.state();
        assertTrue(state.isCompleted());
        assertEquals(Arrays.stream(Phase.values()).map(Phase::key).toList(),
                types(fixture, "R-full", EventTypes.PHASE_START));

        Map<String, Object> finalDraft = state.artifact(Phase.POLISH.outputArtifact());
        String manuscript = (String) finalDraft.get("manuscript");
        assertTrue(manuscript.startsWith("## Scene 1: Night 1"));
        assertTrue(manuscript.contains(ScriptedStoryGenerator.passage(2)));
        assertEquals("The Keeper", finalDraft.get("title"));
        assertTrue(fixture.artifactStore.get("R-full", "final_draft").isPresent());

        Map<String, Object> revision = state.artifact(Phase.REVISION.outputArtifact());
        assertEquals(2, revision.get("totalRevisions"));
        assertEquals(List.of("Mara Vell"), state.getCharacterNames());
        assertTrue(state.getKeyConstraints().stream().anyMatch(c -> c.key().equals("world_genre") && c.immutable()));

        List<RunEvent> all = fixture.eventBus.read("R-full", 0);
        assertEquals(EventTypes.GENERATION_COMPLETED, all.get(all.size() - 1).type());
    }

    @Test
    @DisplayName("an execution starts at the recorded phase")
    void startsAtRecordedPhase() throws Exception {
        ScriptedStoryGenerator generator = new ScriptedStoryGenerator(1);
        EngineFixture fixture = new EngineFixture(generator, new InMemoryArtifactStore());
        RunHandle handle = register(fixture, "R-late", Phase.ORIGINALITY_CHECK);

        assertEquals(RunStatus.COMPLETED, fixture.engine.execute(handle));

        assertEquals(List.of("originality_check", "impact_assessment", "polish"),
                types(fixture, "R-late", EventTypes.PHASE_START));
        assertEquals(0, generator.callsTo(AgentRole.ARCHITECT));
        assertEquals(1, generator.callsTo(AgentRole.ORIGINALITY));
    }

    @Test
    @DisplayName("a provider failure fails the run with a terminal ERROR event")
    void failureEndsWithErrorEvent() throws Exception {
        ScriptedStoryGenerator scripted = new ScriptedStoryGenerator(1);
        TextGenerator generator = request -> {
            if (request.systemPrompt().startsWith("You are the Worldbuilder")) {
                throw new IllegalStateException("401 Unauthorized: invalid api key");
            }
            return scripted.complete(request);
        };
        EngineFixture fixture = new EngineFixture(generator, new InMemoryArtifactStore());
        RunHandle handle = register(fixture, "R-fail", Phase.CONCEPT);

        RunStatus status = fixture.engine.execute(handle);

        assertEquals(RunStatus.FAILED, status);
        assertEquals(RunStatus.FAILED, handle.state().status());
        assertTrue(handle.state().getError().contains("invalid api key"));
        assertEquals(Phase.WORLDBUILDING, handle.state().getPhase());

        List<RunEvent> all = fixture.eventBus.read("R-fail", 0);
        RunEvent last = all.get(all.size() - 1);
        assertEquals(EventTypes.ERROR, last.type());
        assertTrue(last.terminal());
        assertEquals("worldbuilding", last.data().get("phase"));
        assertEquals(0, scripted.callsTo(AgentRole.STRATEGIST));
    }

    @Test
    @DisplayName("a cancelled run stops at its next checkpoint and publishes generation_cancelled")
    void cancelledRunStops() throws Exception {
        EngineFixture fixture = new EngineFixture(new ScriptedStoryGenerator(1), new InMemoryArtifactStore());
        RunHandle handle = register(fixture, "R-cancel", Phase.CONCEPT);
        handle.state().setCancelled(true);

        assertEquals(RunStatus.CANCELLED, fixture.engine.execute(handle));

        List<RunEvent> all = fixture.eventBus.read("R-cancel", 0);
        assertEquals(EventTypes.GENERATION_CANCELLED, all.get(all.size() - 1).type());
        assertTrue(types(fixture, "R-cancel", EventTypes.PHASE_START).isEmpty());
    }
}
