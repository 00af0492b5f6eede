package com.talewright.core.model;

/**
 * The nine collaborating agents that take part in a run.
 */
public enum AgentRole {
    ARCHITECT,
    PROFILER,
    WORLDBUILDER,
    STRATEGIST,
    WRITER,
    CRITIC,
    ORIGINALITY,
    IMPACT,
    ARCHIVIST;

    /** Lower-case name used in event payloads and artifact metadata. */
    public String key() {
        return name().toLowerCase();
    }
}
