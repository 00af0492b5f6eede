package com.talewright.core.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talewright.core.engine.PhaseFailedException;
import com.talewright.core.engine.RunContext;
import com.talewright.core.engine.RunHandle;
import com.talewright.core.events.EventBus;
import com.talewright.core.events.EventTypes;
import com.talewright.core.events.RunEvent;
import com.talewright.core.llm.AgentInvoker;
import com.talewright.core.llm.LlmProperties;
import com.talewright.core.llm.TokenLimitCache;
import com.talewright.core.metrics.TalewrightMetrics;
import com.talewright.core.model.ModelConfig;
import com.talewright.core.model.Phase;
import com.talewright.core.nodes.AbstractAgentPhaseNode;
import com.talewright.core.persistence.InMemoryArtifactStore;
import com.talewright.core.state.PhaseGraphState;
import com.talewright.core.state.RunState;
import com.talewright.core.state.RunStateCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.junit.jupiter.api.Assertions.*;

class PhaseGraphTest {

    private static final String RUN_ID = "TLWR-2026-0007-beef";

    private final TalewrightMetrics metrics = new TalewrightMetrics(new SimpleMeterRegistry());
    private final List<Phase> executed = new ArrayList<>();
    private EventBus eventBus;
    private InMemoryArtifactStore artifactStore;
    private RunState state;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        artifactStore = new InMemoryArtifactStore();
        state = RunState.create(RUN_ID, "P-7", "A clockmaker loses an hour", ModelConfig.of("test-model"),
                Instant.now());
    }

    private AbstractAgentPhaseNode node(Phase phase, Phase failing) {
        return new AbstractAgentPhaseNode(phase) {
            @Override
            public Map<String, Object> execute(RunContext ctx) {
                executed.add(phase);
                if (phase == failing) {
                    throw new IllegalStateException("provider unavailable");
                }
                return Map.of("phase", phase.key());
            }
        };
    }

    private PhaseGraph graph(Phase failing) throws Exception {
        List<AbstractAgentPhaseNode> nodes = new ArrayList<>();
        for (Phase phase : Phase.values()) {
            nodes.add(node(phase, failing));
        }
        return new PhaseGraph(nodes, metrics);
    }

    private RunContext context() {
        RunStateCodec codec = new RunStateCodec();
        AgentInvoker invoker = new AgentInvoker(request -> {
            throw new AssertionError("no agent call expected");
        }, new TokenLimitCache(), metrics, new LlmProperties(), duration -> { });
        return new RunContext(new RunHandle(state, codec.toJson(state)), eventBus, invoker, artifactStore, codec,
                new ObjectMapper());
    }

    @Test
    void missingNodeIsRejected() {
        List<AbstractAgentPhaseNode> nodes = new ArrayList<>();
        for (Phase phase : Phase.values()) {
            if (phase != Phase.CRITIQUE) {
                nodes.add(node(phase, null));
            }
        }
        var e = assertThrows(IllegalStateException.class, () -> new PhaseGraph(nodes, metrics));
        assertTrue(e.getMessage().contains("CRITIQUE"));
    }

    @Test
    void routeFollowsCursorUntilHaltedOrDone() throws Exception {
        PhaseGraph graph = graph(null);
        assertEquals("outlining", graph.route(new PhaseGraphState(Map.of("phase", "OUTLINING"))));
        assertEquals(END, graph.route(new PhaseGraphState(Map.of("phase", "OUTLINING", "halted", true))));
        assertEquals(END, graph.route(new PhaseGraphState(Map.of("phase", "POLISH", "done", true))));
    }

    @Test
    void runsEveryPhaseAndStoresArtifacts() throws Exception {
        RunContext ctx = context();

        assertTrue(graph(null).execute(ctx));

        assertEquals(Arrays.asList(Phase.values()), executed);
        assertEquals(Phase.POLISH, state.getPhase());
        assertEquals("concept", state.artifact("narrative").get("phase"));
        assertTrue(artifactStore.get(RUN_ID, "final_draft").isPresent());
        List<RunEvent> starts = eventBus.read(RUN_ID, 0).stream()
                .filter(e -> e.type().equals(EventTypes.PHASE_START)).toList();
        assertEquals(12, starts.size());
    }

    @Test
    void entersAtRecordedPhase() throws Exception {
        state.setPhase(Phase.IMPACT_ASSESSMENT);

        assertTrue(graph(null).execute(context()));

        assertEquals(List.of(Phase.IMPACT_ASSESSMENT, Phase.POLISH), executed);
    }

    @Test
    void nodeFailureIsLeftOnContext() throws Exception {
        RunContext ctx = context();

        assertFalse(graph(Phase.WORLDBUILDING).execute(ctx));

        assertEquals(Phase.WORLDBUILDING, state.getPhase());
        assertEquals(Phase.WORLDBUILDING, executed.get(executed.size() - 1));
        RuntimeException failure = ctx.failure().orElseThrow();
        assertInstanceOf(PhaseFailedException.class, failure);
        assertEquals(Phase.WORLDBUILDING, ((PhaseFailedException) failure).phase());
        assertTrue(failure.getMessage().contains("provider unavailable"));
    }
}
