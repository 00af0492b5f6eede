package com.talewright.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventStreamerTest {

    private EventBus eventBus;
    private EventStreamer streamer;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        streamer = new EventStreamer(eventBus, Duration.ofMillis(20));
    }

    /** Records what the streamer sends; optionally closes itself after a number of heartbeats. */
    static class RecordingSink implements EventSink {
        final List<RunEvent> events = new CopyOnWriteArrayList<>();
        final AtomicInteger heartbeats = new AtomicInteger();
        final AtomicBoolean open = new AtomicBoolean(true);
        private final int closeAfterHeartbeats;

        RecordingSink(int closeAfterHeartbeats) {
            this.closeAfterHeartbeats = closeAfterHeartbeats;
        }

        @Override
        public void send(RunEvent event) {
            events.add(event);
        }

        @Override
        public void heartbeat(String runId, Instant at) {
            if (heartbeats.incrementAndGet() >= closeAfterHeartbeats) {
                open.set(false);
            }
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        List<Long> ids() {
            return events.stream().map(RunEvent::id).toList();
        }
    }

    @Test
    @DisplayName("replays the backlog and stops at a terminal event")
    void replaysUntilTerminal() {
        eventBus.publish("R-1", EventTypes.GENERATION_STARTED, Map.of());
        eventBus.publish("R-1", EventTypes.PHASE_START, Map.of());
        eventBus.publish("R-1", EventTypes.GENERATION_COMPLETED, Map.of());
        eventBus.publish("R-1", EventTypes.RUN_PAUSED, Map.of());

        RecordingSink sink = new RecordingSink(Integer.MAX_VALUE);
        long cursor = streamer.stream("R-1", 0, sink);

        assertEquals(List.of(1L, 2L, 3L), sink.ids());
        assertEquals(3, cursor);
    }

    @Test
    @DisplayName("resumes after the client's last seen id")
    void resumesAfterLastSeen() {
        for (int i = 0; i < 4; i++) {
            eventBus.publish("R-1", EventTypes.PHASE_START, Map.of());
        }
        eventBus.publish("R-1", EventTypes.ERROR, Map.of("error", "boom"));

        RecordingSink sink = new RecordingSink(Integer.MAX_VALUE);
        streamer.stream("R-1", 3, sink);

        assertEquals(List.of(4L, 5L), sink.ids());
    }

    @Test
    @DisplayName("continues from catch-up into live delivery without gaps or duplicates")
    void catchUpThenLive() throws Exception {
        eventBus.publish("R-1", EventTypes.GENERATION_STARTED, Map.of());
        eventBus.publish("R-1", EventTypes.PHASE_START, Map.of());

        RecordingSink sink = new RecordingSink(Integer.MAX_VALUE);
        CompletableFuture<Long> streaming = CompletableFuture.supplyAsync(() -> streamer.stream("R-1", 0, sink));

        eventBus.publish("R-1", EventTypes.PHASE_COMPLETE, Map.of());
        Thread.sleep(30);
        eventBus.publish("R-1", EventTypes.PHASE_START, Map.of());
        eventBus.publish("R-1", EventTypes.GENERATION_CANCELLED, Map.of());

        long cursor = streaming.get(5, TimeUnit.SECONDS);
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), sink.ids());
        assertEquals(5, cursor);
    }

    @Test
    @DisplayName("sends heartbeats while idle and stops when the sink closes")
    void heartbeatsUntilClosed() {
        eventBus.publish("R-1", EventTypes.PHASE_START, Map.of());

        RecordingSink sink = new RecordingSink(2);
        long cursor = streamer.stream("R-1", 0, sink);

        assertEquals(1, cursor);
        assertEquals(2, sink.heartbeats.get());
        assertEquals(List.of(1L), sink.ids());
    }

    @Test
    @DisplayName("stops when the sink fails to write")
    void stopsOnWriteFailure() {
        eventBus.publish("R-1", EventTypes.PHASE_START, Map.of());
        eventBus.publish("R-1", EventTypes.PHASE_COMPLETE, Map.of());

        EventSink failing = new EventSink() {
            @Override
            public void send(RunEvent event) throws IOException {
                throw new IOException("client gone");
            }

            @Override
            public void heartbeat(String runId, Instant at) {
                fail("no heartbeat expected");
            }
        };

        assertEquals(0, streamer.stream("R-1", 0, failing));
    }

    @Test
    @DisplayName("ends the stream once the run's log is evicted")
    void stopsWhenRunIsEvicted() throws Exception {
        eventBus.publish("R-1", EventTypes.PHASE_START, Map.of());
        RecordingSink sink = new RecordingSink(Integer.MAX_VALUE);

        CompletableFuture<Long> streaming = CompletableFuture.supplyAsync(() -> streamer.stream("R-1", 0, sink));
        Thread.sleep(50);
        eventBus.evict("R-1");

        assertEquals(1L, streaming.get(2, TimeUnit.SECONDS));
        assertEquals(List.of(1L), sink.ids());
    }
}
