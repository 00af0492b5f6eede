package com.talewright.core.graph;

import com.talewright.core.engine.PhaseFailedException;
import com.talewright.core.engine.RunContext;
import com.talewright.core.engine.RunHaltedException;
import com.talewright.core.events.EventTypes;
import com.talewright.core.logging.MdcContext;
import com.talewright.core.metrics.TalewrightMetrics;
import com.talewright.core.model.Phase;
import com.talewright.core.nodes.AbstractAgentPhaseNode;
import com.talewright.core.state.PhaseGraphState;
import com.talewright.core.state.RunState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that walks a run through its phases.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> resume -> [route] -> concept -> [route] -> characters -> ... -> polish -> [route] -> END
 * </pre>
 * The resume router enters at the phase recorded in the run's state, so a resumed run continues
 * where it stopped. After every phase the router goes to the next phase, or to {@code END} when the
 * run halted, failed or finished. The graph carries only the cursor; the run's state is reached
 * through the {@link RunContext} registered for the duration of {@link #execute(RunContext)}.
 */
@Component
public class PhaseGraph {

    private static final Logger log = LoggerFactory.getLogger(PhaseGraph.class);

    static final String RESUME = "resume";

    private final CompiledGraph<PhaseGraphState> compiledGraph;
    private final TalewrightMetrics metrics;
    private final Map<String, RunContext> contexts = new ConcurrentHashMap<>();

    public PhaseGraph(List<AbstractAgentPhaseNode> nodes, TalewrightMetrics metrics) throws Exception {
        this.metrics = metrics;

        Map<Phase, AbstractAgentPhaseNode> byPhase = new EnumMap<>(Phase.class);
        for (AbstractAgentPhaseNode node : nodes) {
            byPhase.put(node.phase(), node);
        }
        for (Phase phase : Phase.values()) {
            if (!byPhase.containsKey(phase)) {
                throw new IllegalStateException("No node registered for phase " + phase);
            }
        }

        Map<String, String> routes = new HashMap<>();
        for (Phase phase : Phase.values()) {
            routes.put(phase.key(), phase.key());
        }
        routes.put(END, END);

        var graph = new StateGraph<>(PhaseGraphState.SCHEMA, PhaseGraphState::new)
                .addNode(RESUME, node_async(state -> Map.of()))
                .addEdge(START, RESUME)
                .addConditionalEdges(RESUME, edge_async(this::route), routes);
        for (Phase phase : Phase.values()) {
            AbstractAgentPhaseNode node = byPhase.get(phase);
            graph.addNode(phase.key(), node_async(state -> runPhase(node, state)))
                    .addConditionalEdges(phase.key(), edge_async(this::route), routes);
        }

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Phase graph compiled with {} phase nodes", byPhase.size());
    }

    /**
     * Runs the run from its recorded phase until it finishes, halts or fails. A failure is left on
     * the context rather than thrown.
     *
     * @return true if the last phase completed
     */
    public boolean execute(RunContext ctx) {
        String runId = ctx.runId();
        contexts.put(runId, ctx);
        try {
            Map<String, Object> input = Map.of(
                    "runId", runId,
                    "phase", ctx.state().getPhase().name());
            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();
            Optional<PhaseGraphState> result = compiledGraph.invoke(input, config);
            return result.map(PhaseGraphState::done).orElse(false);
        } finally {
            contexts.remove(runId);
        }
    }

    /**
     * Next node: {@code END} when the run halted or finished, else the phase cursor.
     */
    String route(PhaseGraphState state) {
        if (state.halted() || state.done()) {
            return END;
        }
        return state.phase().key();
    }

    private Map<String, Object> runPhase(AbstractAgentPhaseNode node, PhaseGraphState graphState) {
        RunContext ctx = contexts.get(graphState.runId());
        if (ctx == null) {
            throw new IllegalStateException("No execution registered for run " + graphState.runId());
        }
        Phase phase = node.phase();
        RunState state = ctx.state();
        MdcContext.setPhase(ctx.runId(), phase.key());
        long start = System.currentTimeMillis();
        try {
            ctx.checkpoint();
            log.info("Phase {} started", phase);
            ctx.publish(EventTypes.PHASE_START, Map.of(
                    "phase", phase.key(), "agent", phase.primaryAgent().key()));

            Map<String, Object> artifact = node.execute(ctx);
            state.putArtifact(phase.outputArtifact(), artifact);
            ctx.saveArtifact(phase.outputArtifact(), artifact);

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordPhaseDuration(phase.key(), elapsed);
            ctx.publish(EventTypes.PHASE_COMPLETE, Map.of(
                    "phase", phase.key(), "artifact", phase.outputArtifact(), "durationMs", elapsed));
            log.info("Phase {} completed in {} ms", phase, elapsed);

            Optional<Phase> next = phase.next();
            if (next.isEmpty()) {
                return Map.of("done", true);
            }
            state.setPhase(next.get());
            return Map.of("phase", next.get().name());
        } catch (RunHaltedException e) {
            log.info("Phase {} stopped at checkpoint: {}", phase, e.haltCause());
            return Map.of("halted", true);
        } catch (PhaseFailedException e) {
            ctx.fail(e);
            return Map.of("halted", true);
        } catch (RuntimeException e) {
            ctx.fail(new PhaseFailedException(phase, e.getMessage(), e));
            return Map.of("halted", true);
        } finally {
            MdcContext.clearPhase();
        }
    }
}
