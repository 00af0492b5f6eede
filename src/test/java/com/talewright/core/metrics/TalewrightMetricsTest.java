package com.talewright.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TalewrightMetricsTest {

    private SimpleMeterRegistry registry;
    private TalewrightMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TalewrightMetrics(registry);
    }

    @Test
    @DisplayName("recordRunResult increments by status tag")
    void recordRunResult() {
        metrics.recordRunResult("COMPLETED");
        metrics.recordRunResult("COMPLETED");
        metrics.recordRunResult("FAILED");

        assertEquals(2.0, registry.find("talewright.runs.total").tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.find("talewright.runs.total").tag("status", "FAILED").counter().count());
    }

    @Test
    @DisplayName("recordPhaseDuration creates a timer per phase")
    void recordPhaseDuration() {
        metrics.recordPhaseDuration("concept", 1500);
        metrics.recordPhaseDuration("drafting", 90_000);

        var timer = registry.find("talewright.phase.duration").tag("phase", "concept").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertNotNull(registry.find("talewright.phase.duration").tag("phase", "drafting").timer());
    }

    @Test
    @DisplayName("recordAgentCall tags agent and outcome")
    void recordAgentCall() {
        metrics.recordAgentCall("writer", "ok", 200);
        metrics.recordAgentCall("critic", "corrected", 100);

        assertEquals(1, registry.find("talewright.agent.duration")
                .tag("agent", "writer").tag("outcome", "ok").timer().count());
        assertEquals(1, registry.find("talewright.agent.duration")
                .tag("agent", "critic").tag("outcome", "corrected").timer().count());
    }

    @Test
    @DisplayName("recordRevisions feeds a distribution summary")
    void recordRevisions() {
        metrics.recordRevisions(2);
        metrics.recordRevisions(0);

        var summary = registry.find("talewright.scene.revisions").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(2.0, summary.totalAmount());
    }

    @Test
    @DisplayName("retry, fallback and snapshot counters")
    void counters() {
        metrics.incrementProviderRetries("transient");
        metrics.recordPolishFallback("CHUNK_LOSS");
        metrics.recordSnapshots(3);

        assertEquals(1.0, registry.find("talewright.provider.retries").tag("kind", "transient").counter().count());
        assertEquals(1.0, registry.find("talewright.polish.fallbacks").tag("reason", "CHUNK_LOSS").counter().count());
        assertEquals(3.0, registry.find("talewright.snapshots.saved").counter().count());
    }
}
