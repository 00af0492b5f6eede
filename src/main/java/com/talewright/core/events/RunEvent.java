package com.talewright.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event in a run's progress log, delivered over SSE and to CLI watchers.
 *
 * @param id        per-run sequence number assigned by the {@link EventBus}, strictly increasing, never reused
 * @param type      event type (see {@link EventTypes})
 * @param runId     the run this event belongs to
 * @param timestamp when the event was appended
 * @param data      event payload
 */
public record RunEvent(
    long id,
    String type,
    String runId,
    Instant timestamp,
    Map<String, Object> data
) implements Serializable {

    public boolean terminal() {
        return EventTypes.TERMINAL.contains(type);
    }
}
