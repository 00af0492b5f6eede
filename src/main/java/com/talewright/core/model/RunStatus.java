package com.talewright.core.model;

/**
 * Externally visible lifecycle state of a run, derived from its {@code RunState} flags.
 */
public enum RunStatus {
    RUNNING,
    PAUSED,
    CANCELLED,
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this == CANCELLED || this == COMPLETED || this == FAILED;
    }
}
