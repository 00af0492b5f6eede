package com.talewright.core.engine;

import com.talewright.core.model.Phase;

/**
 * A phase could not produce its artifact.
 */
public class PhaseFailedException extends RuntimeException {

    private final Phase phase;

    public PhaseFailedException(Phase phase, String message) {
        super(message);
        this.phase = phase;
    }

    public PhaseFailedException(Phase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public Phase phase() {
        return phase;
    }
}
