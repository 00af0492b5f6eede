package com.talewright.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("backoff grows exponentially and is capped")
    void exponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofMillis(500), 2.0);

        assertEquals(Duration.ofMillis(100), policy.backoffAfter(1));
        assertEquals(Duration.ofMillis(200), policy.backoffAfter(2));
        assertEquals(Duration.ofMillis(400), policy.backoffAfter(3));
        assertEquals(Duration.ofMillis(500), policy.backoffAfter(4));
    }

    @Test
    @DisplayName("default policy matches the configured defaults")
    void defaultPolicy() {
        assertEquals(new LlmProperties().retryPolicy(), RetryPolicy.defaultPolicy());
    }

    @Test
    @DisplayName("rejects invalid parameters")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(2), 2.0));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(2), 0.5));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(2), 2.0));
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.defaultPolicy().backoffAfter(0));
    }
}
