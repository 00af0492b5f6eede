package com.talewright.core.model;

import java.util.List;
import java.util.Optional;

/**
 * The twelve generation phases of a run, in their fixed execution order.
 * <p>
 * Each phase names the agent that owns it, the agents it may consult, the artifact type it
 * persists, and the output-token budget requested from the model for its calls.
 */
public enum Phase {
    CONCEPT(AgentRole.ARCHITECT, List.of(), "narrative", 8192),
    CHARACTERS(AgentRole.PROFILER, List.of(AgentRole.ARCHITECT), "characters", 10240),
    NARRATOR_DESIGN(AgentRole.PROFILER, List.of(AgentRole.ARCHITECT), "narrator", 6144),
    WORLDBUILDING(AgentRole.WORLDBUILDER, List.of(AgentRole.ARCHITECT), "worldbuilding", 12288),
    OUTLINING(AgentRole.STRATEGIST, List.of(AgentRole.ARCHITECT), "outline", 16384),
    ADVANCED_PLANNING(AgentRole.STRATEGIST, List.of(AgentRole.ARCHITECT), "advanced_plan", 8192),
    DRAFTING(AgentRole.WRITER, List.of(AgentRole.ARCHIVIST), "draft", 16384),
    CRITIQUE(AgentRole.CRITIC, List.of(), "critique", 6144),
    REVISION(AgentRole.WRITER, List.of(AgentRole.CRITIC, AgentRole.ARCHIVIST), "revision", 16384),
    ORIGINALITY_CHECK(AgentRole.ORIGINALITY, List.of(), "originality_report", 4096),
    IMPACT_ASSESSMENT(AgentRole.IMPACT, List.of(), "impact_report", 8192),
    POLISH(AgentRole.WRITER, List.of(AgentRole.ARCHIVIST), "final_draft", 12288);

    private final AgentRole primaryAgent;
    private final List<AgentRole> supportingAgents;
    private final String outputArtifact;
    private final int maxOutputTokens;

    Phase(AgentRole primaryAgent, List<AgentRole> supportingAgents, String outputArtifact, int maxOutputTokens) {
        this.primaryAgent = primaryAgent;
        this.supportingAgents = supportingAgents;
        this.outputArtifact = outputArtifact;
        this.maxOutputTokens = maxOutputTokens;
    }

    public AgentRole primaryAgent() {
        return primaryAgent;
    }

    public List<AgentRole> supportingAgents() {
        return supportingAgents;
    }

    public String outputArtifact() {
        return outputArtifact;
    }

    public int maxOutputTokens() {
        return maxOutputTokens;
    }

    /** Lower-case name used in event payloads and graph node ids. */
    public String key() {
        return name().toLowerCase();
    }

    /**
     * Returns the phase that follows this one, or empty if this is the last phase.
     */
    public Optional<Phase> next() {
        Phase[] all = values();
        int idx = ordinal() + 1;
        return idx < all.length ? Optional.of(all[idx]) : Optional.empty();
    }
}
