package com.talewright.core.llm;

import com.talewright.core.model.AgentRole;

/**
 * Thrown when an agent call fails for good: a non-retryable provider error, or retries exhausted.
 */
public class AgentInvocationException extends RuntimeException {

    private final AgentRole role;
    private final int attempts;

    public AgentInvocationException(AgentRole role, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
        this.attempts = attempts;
    }

    public AgentRole role() {
        return role;
    }

    public int attempts() {
        return attempts;
    }
}
