package com.talewright.dispatch.api;

import com.talewright.core.events.EventSink;
import com.talewright.core.events.EventStreamer;
import com.talewright.core.events.RunEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private static final RunEvent EVENT = new RunEvent(3, "scene_final", "R-1",
            Instant.parse("2026-01-01T00:00:00Z"), Map.of("sceneNumber", 1));

    /** Emitter that records the frames it is asked to send. */
    static class RecordingEmitter extends SseEmitter {

        final List<String> frames = new ArrayList<>();

        @Override
        public void send(SseEventBuilder builder) {
            StringBuilder sb = new StringBuilder();
            for (ResponseBodyEmitter.DataWithMediaType part : builder.build()) {
                sb.append(part.getData());
            }
            frames.add(sb.toString());
        }
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("streams the run from the client's last seen id on a worker thread")
        void streamsFromLastSeenId() {
            EventStreamer streamer = mock(EventStreamer.class);
            when(streamer.stream(eq("R-1"), eq(5L), any(EventSink.class))).thenReturn(7L);
            SseStreamingService service = new SseStreamingService(streamer, 60_000);

            SseEmitter emitter = service.createEmitter("R-1", 5);

            assertNotNull(emitter);
            verify(streamer, timeout(2000)).stream(eq("R-1"), eq(5L), any(EventSink.class));
        }

        @Test
        @DisplayName("separate connections get separate emitters")
        void separateEmitters() {
            EventStreamer streamer = mock(EventStreamer.class);
            SseStreamingService service = new SseStreamingService(streamer, 60_000);

            assertNotSame(service.createEmitter("R-1", 0), service.createEmitter("R-1", 0));
        }
    }

    @Nested
    @DisplayName("frames")
    class FrameTests {

        @Test
        @DisplayName("frame carries id, type, run id, timestamp and data")
        void frameContents() {
            Map<String, Object> frame = SseStreamingService.frame(EVENT);

            assertEquals(3L, frame.get("id"));
            assertEquals("scene_final", frame.get("type"));
            assertEquals("R-1", frame.get("runId"));
            assertEquals("2026-01-01T00:00:00Z", frame.get("timestamp"));
            assertEquals(Map.of("sceneNumber", 1), frame.get("data"));
        }

        @Test
        @DisplayName("events are sent with their id and type so clients can resume")
        void sendsIdAndName() throws IOException {
            RecordingEmitter emitter = new RecordingEmitter();
            SseStreamingService.EmitterSink sink = new SseStreamingService.EmitterSink("R-1", emitter);

            sink.send(EVENT);
            sink.heartbeat("R-1", Instant.parse("2026-01-01T00:00:15Z"));

            assertEquals(2, emitter.frames.size());
            assertTrue(emitter.frames.get(0).contains("id:3"));
            assertTrue(emitter.frames.get(0).contains("event:scene_final"));
            assertTrue(emitter.frames.get(1).startsWith(":heartbeat"));
        }

        @Test
        @DisplayName("sending on a completed emitter closes the sink")
        void completedEmitterClosesSink() {
            SseEmitter emitter = new SseEmitter();
            SseStreamingService.EmitterSink sink = new SseStreamingService.EmitterSink("R-1", emitter);
            emitter.complete();

            assertThrows(IOException.class, () -> sink.send(EVENT));
            assertFalse(sink.isOpen());
        }
    }
}
