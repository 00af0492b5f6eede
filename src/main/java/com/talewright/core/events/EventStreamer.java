package com.talewright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Delivers a run's events to one {@link EventSink}: catch-up first, then live.
 * <p>
 * Catch-up replays every retained event after the client's last seen id (0 for a fresh
 * subscriber). Live delivery then polls the bus starting immediately after the last replayed id,
 * never from "now", so an event appended between the two steps is still delivered exactly once.
 * A poll timeout with nothing new produces a heartbeat. Streaming ends after a terminal event,
 * when the sink closes or fails to write, and when the bus no longer tracks the run.
 */
@Component
public class EventStreamer {

    private static final Logger log = LoggerFactory.getLogger(EventStreamer.class);

    private final EventBus eventBus;
    private final Duration heartbeatInterval;

    @Autowired
    public EventStreamer(EventBus eventBus, EventBusProperties properties) {
        this(eventBus, properties.getHeartbeatInterval());
    }

    public EventStreamer(EventBus eventBus, Duration heartbeatInterval) {
        this.eventBus = eventBus;
        this.heartbeatInterval = heartbeatInterval;
    }

    /**
     * Streams the run to the sink until a terminal event, sink closure, or write failure.
     *
     * @param runId      run to stream
     * @param lastSeenId id of the last event the client already has (0 for none)
     * @param sink       destination
     * @return id of the last event delivered (or {@code lastSeenId} if none), for reconnection
     */
    public long stream(String runId, long lastSeenId, EventSink sink) {
        long cursor = lastSeenId;
        try {
            List<RunEvent> backlog = eventBus.read(runId, cursor);
            log.debug("Catch-up for run {} after #{}: {} event(s)", runId, cursor, backlog.size());
            for (RunEvent event : backlog) {
                sink.send(event);
                cursor = event.id();
                if (event.terminal()) {
                    return cursor;
                }
            }

            while (sink.isOpen() && !Thread.currentThread().isInterrupted()) {
                List<RunEvent> batch = eventBus.poll(runId, cursor, heartbeatInterval);
                if (batch.isEmpty() && !eventBus.isTracked(runId)) {
                    log.debug("Run {} is no longer tracked; ending stream after #{}", runId, cursor);
                    return cursor;
                }
                if (batch.isEmpty()) {
                    if (sink.isOpen()) {
                        sink.heartbeat(runId, Instant.now());
                    }
                    continue;
                }
                for (RunEvent event : batch) {
                    sink.send(event);
                    cursor = event.id();
                    if (event.terminal()) {
                        log.debug("Run {} reached terminal event {} (#{})", runId, event.type(), cursor);
                        return cursor;
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Stream for run {} closed by client after #{}: {}", runId, cursor, e.getMessage());
        }
        return cursor;
    }
}
