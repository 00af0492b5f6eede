package com.talewright.core.events;

import java.io.IOException;
import java.time.Instant;

/**
 * Destination of a streamed run, e.g. an SSE connection or a console.
 */
public interface EventSink {

    void send(RunEvent event) throws IOException;

    void heartbeat(String runId, Instant at) throws IOException;

    /** False once the client has gone away; the streamer then stops. */
    default boolean isOpen() {
        return true;
    }
}
