package com.talewright.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.talewright.core.events.EventBus;
import com.talewright.core.events.EventTypes;
import com.talewright.core.graph.PhaseGraph;
import com.talewright.core.llm.AgentInvoker;
import com.talewright.core.logging.MdcContext;
import com.talewright.core.metrics.TalewrightMetrics;
import com.talewright.core.model.RunStatus;
import com.talewright.core.model.SceneDraft;
import com.talewright.core.persistence.ArtifactStore;
import com.talewright.core.state.RunState;
import com.talewright.core.state.RunStateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes a run by bridging its {@link RunHandle} to the {@link PhaseGraph}.
 * <p>
 * One call to {@link #execute(RunHandle)} is one execution: it runs from the recorded phase until
 * the run finishes, halts at a checkpoint, or fails. Failures never escape: they are recorded on
 * the state and published as an {@code ERROR} event so no subscriber waits forever.
 */
@Service
public class PhaseEngine {

    private static final Logger log = LoggerFactory.getLogger(PhaseEngine.class);

    private final PhaseGraph phaseGraph;
    private final EventBus eventBus;
    private final AgentInvoker invoker;
    private final ArtifactStore artifactStore;
    private final RunStateCodec codec;
    private final TalewrightMetrics metrics;
    private final ObjectMapper mapper;

    public PhaseEngine(PhaseGraph phaseGraph, EventBus eventBus, AgentInvoker invoker, ArtifactStore artifactStore,
                       RunStateCodec codec, TalewrightMetrics metrics) {
        this.phaseGraph = phaseGraph;
        this.eventBus = eventBus;
        this.invoker = invoker;
        this.artifactStore = artifactStore;
        this.codec = codec;
        this.metrics = metrics;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Runs the run until it completes, halts or fails. The caller must hold the run's claim.
     *
     * @return the run's status when the execution stopped
     */
    public RunStatus execute(RunHandle handle) {
        RunState state = handle.state();
        String runId = handle.runId();
        RunContext ctx = new RunContext(handle, eventBus, invoker, artifactStore, codec, mapper);
        MdcContext.setRun(runId);
        try {
            log.info("Executing run {} from phase {}", runId, state.getPhase());
            boolean done;
            try {
                done = phaseGraph.execute(ctx);
            } catch (RuntimeException e) {
                ctx.fail(e);
                done = false;
            }

            if (ctx.failure().isPresent()) {
                return fail(ctx, ctx.failure().get());
            }
            if (done) {
                return complete(ctx);
            }
            if (state.isCancelled()) {
                log.info("Run {} cancelled in phase {}", runId, state.getPhase());
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("phase", state.getPhase().key());
                data.put("currentScene", state.getCurrentScene());
                data.put("totalScenes", state.getTotalScenes());
                ctx.publish(EventTypes.GENERATION_CANCELLED, data);
                metrics.recordRunResult(RunStatus.CANCELLED.name());
                return RunStatus.CANCELLED;
            }
            log.info("Run {} paused before phase {} scene {}", runId, state.getPhase(), state.getCurrentScene());
            return RunStatus.PAUSED;
        } finally {
            MdcContext.clear();
        }
    }

    private RunStatus complete(RunContext ctx) {
        RunState state = ctx.state();
        state.setCompleted(true);
        state.setUpdatedAt(Instant.now());
        int words = state.getDrafts().values().stream().mapToInt(SceneDraft::wordCount).sum();
        ctx.publish(EventTypes.GENERATION_COMPLETED, Map.of(
                "runId", ctx.runId(),
                "scenes", state.getTotalScenes(),
                "wordCount", words));
        metrics.recordRunResult(RunStatus.COMPLETED.name());
        log.info("Run {} completed: {} scene(s), {} words", ctx.runId(), state.getTotalScenes(), words);
        return RunStatus.COMPLETED;
    }

    private RunStatus fail(RunContext ctx, RuntimeException failure) {
        RunState state = ctx.state();
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        log.error("Run {} failed in phase {}: {}", ctx.runId(), state.getPhase(), message, failure);
        state.setError(message);
        state.setUpdatedAt(Instant.now());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", message);
        data.put("phase", state.getPhase().key());
        data.put("currentScene", state.getCurrentScene());
        data.put("totalScenes", state.getTotalScenes());
        data.put("recoverable", false);
        ctx.publish(EventTypes.ERROR, data);
        metrics.recordRunResult(RunStatus.FAILED.name());
        return RunStatus.FAILED;
    }
}
