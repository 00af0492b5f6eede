package com.talewright.core.state;

import java.time.Instant;

/**
 * Durable form of a run saved during graceful shutdown.
 *
 * @param state       the run's state at its last checkpoint
 * @param lastEventId id of the last event published for the run, so numbering continues after restore
 * @param savedAt     when the snapshot was written
 */
public record RunSnapshot(RunState state, long lastEventId, Instant savedAt) {
}
