package com.talewright.core.nodes;

import com.talewright.core.engine.RunContext;
import com.talewright.core.llm.AgentReply;
import com.talewright.core.llm.OutputFormat;
import com.talewright.core.llm.StructuredReply;
import com.talewright.core.model.Phase;
import com.talewright.core.model.SceneDraft;
import com.talewright.core.state.RunState;

import java.util.Map;

/**
 * Base for the twelve phase nodes. A node produces its phase's output artifact; the phase graph
 * takes care of checkpoints, events, persistence and advancing the phase cursor.
 */
public abstract class AbstractAgentPhaseNode {

    private final Phase phase;

    protected AbstractAgentPhaseNode(Phase phase) {
        this.phase = phase;
    }

    public Phase phase() {
        return phase;
    }

    /**
     * Runs the phase.
     *
     * @return the output artifact, stored under {@link Phase#outputArtifact()}
     */
    public abstract Map<String, Object> execute(RunContext ctx);

    /**
     * Asks the phase's primary agent for a JSON artifact and records the turn.
     */
    protected Map<String, Object> askPrimary(RunContext ctx, String task, String context) {
        AgentReply reply = ctx.callAndRecord(phase.primaryAgent(), null,
                ctx.prompt(phase, 0, task, context, OutputFormat.JSON));
        return reply.json();
    }

    /**
     * Asks the phase's primary agent for a reply bound to {@code type} and records the turn. The
     * parsed JSON of the reply stays available as the artifact.
     */
    protected <T> StructuredReply<T> askPrimary(RunContext ctx, String task, String context, Class<T> type) {
        return ctx.callStructuredAndRecord(phase.primaryAgent(), null,
                ctx.prompt(phase, 0, task, context, OutputFormat.JSON), type);
    }

    /**
     * Earlier phase artifacts rendered as prompt context, skipping any that are missing.
     */
    protected static String priorArtifacts(RunContext ctx, Phase... phases) {
        RunState state = ctx.state();
        StringBuilder sb = new StringBuilder("SEED IDEA:\n").append(state.getSeedIdea());
        for (Phase prior : phases) {
            Map<String, Object> artifact = state.artifact(prior.outputArtifact());
            if (!artifact.isEmpty()) {
                sb.append("\n\n").append(prior.outputArtifact().toUpperCase()).append(":\n").append(ctx.render(artifact));
            }
        }
        return sb.toString();
    }

    /**
     * The finalized scenes joined in order, each under a heading.
     */
    protected static String manuscript(RunState state) {
        StringBuilder sb = new StringBuilder();
        for (SceneDraft draft : state.getDrafts().values()) {
            String title = state.sceneOutline(draft.sceneNumber()).map(s -> s.title()).orElse("");
            if (!sb.isEmpty()) {
                sb.append("\n\n");
            }
            sb.append("## Scene ").append(draft.sceneNumber());
            if (title != null && !title.isBlank()) {
                sb.append(": ").append(title);
            }
            sb.append("\n\n").append(draft.content());
        }
        return sb.toString();
    }
}
