package com.talewright.core.engine;

/**
 * Raised at a checkpoint when the run has been paused or cancelled. Unwinds the execution
 * without marking the run failed.
 */
public class RunHaltedException extends RuntimeException {

    public enum Cause {
        PAUSED,
        CANCELLED
    }

    private final Cause haltCause;

    public RunHaltedException(String runId, Cause haltCause) {
        super("Run " + runId + " halted: " + haltCause);
        this.haltCause = haltCause;
    }

    public Cause haltCause() {
        return haltCause;
    }
}
