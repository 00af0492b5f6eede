package com.talewright.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for run execution.
 */
@Service
public class TalewrightMetrics {

    private final MeterRegistry registry;

    public TalewrightMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String status) {
        Counter.builder("talewright.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordPhaseDuration(String phase, long ms) {
        Timer.builder("talewright.phase.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAgentCall(String agent, String outcome, long ms) {
        Timer.builder("talewright.agent.duration")
                .tag("agent", agent)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementProviderRetries(String kind) {
        Counter.builder("talewright.provider.retries")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordRevisions(int revisions) {
        DistributionSummary.builder("talewright.scene.revisions")
                .register(registry)
                .record(revisions);
    }

    /**
     * Records a polished scene that failed validation and fell back to its pre-polish draft.
     *
     * @param reason validation rule that rejected the polish
     */
    public void recordPolishFallback(String reason) {
        Counter.builder("talewright.polish.fallbacks")
                .description("Polish passes rejected by validation")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSnapshots(int saved) {
        Counter.builder("talewright.snapshots.saved")
                .register(registry)
                .increment(saved);
    }
}
