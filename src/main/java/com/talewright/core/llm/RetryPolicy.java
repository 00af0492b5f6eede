package com.talewright.core.llm;

import java.time.Duration;

/**
 * Exponential backoff for transient provider failures.
 * <p>
 * Invariants: maxAttempts >= 1, multiplier >= 1.0, maxBackoff >= initialBackoff.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    /**
     * Default policy: 3 attempts, backoff starting at 1s and doubling, capped at 30s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);
    }

    /**
     * Backoff to wait after the given failed attempt.
     *
     * @param attemptNumber 1-indexed attempt that just failed
     */
    public Duration backoffAfter(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        double ms = initialBackoff.toMillis() * Math.pow(multiplier, attemptNumber - 1);
        return Duration.ofMillis((long) Math.min(ms, maxBackoff.toMillis()));
    }
}
