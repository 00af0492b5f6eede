package com.talewright.dispatch.api;

import com.talewright.core.events.EventSink;
import com.talewright.core.events.EventStreamer;
import com.talewright.core.events.RunEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges {@link EventStreamer} to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each connection gets its own streaming task: the retained backlog after the client's last seen
 * id is replayed first, then live events follow. Every frame carries the event id so a client
 * reconnecting with {@code Last-Event-ID} resumes without gaps or duplicates. Idle periods are
 * filled with SSE comment heartbeats, which EventSource clients ignore but which keep the
 * connection alive through proxies. The emitter is completed after a terminal event.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes (for long-running generations). */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private final EventStreamer eventStreamer;
    private final long timeoutMs;
    private final AtomicInteger activeStreams = new AtomicInteger();

    private final AtomicInteger threadCounter = new AtomicInteger();

    private final ExecutorService streamExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-stream-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventStreamer eventStreamer) {
        this(eventStreamer, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventStreamer eventStreamer, long timeoutMs) {
        this.eventStreamer = eventStreamer;
        this.timeoutMs = timeoutMs;
    }

    @PreDestroy
    void stopStreams() {
        streamExecutor.shutdownNow();
        log.info("SSE streaming executor stopped");
    }

    /**
     * Creates an SSE emitter that streams the run's events after {@code lastEventId}.
     *
     * @param runId       the run to stream
     * @param lastEventId id of the last event the client already has (0 for none)
     * @return a configured {@link SseEmitter}
     */
    public SseEmitter createEmitter(String runId, long lastEventId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EmitterSink sink = new EmitterSink(runId, emitter);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for run {}", runId);
            sink.close();
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", runId);
            sink.close();
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", runId, ex.getMessage());
            sink.close();
        });

        streamExecutor.execute(() -> {
            activeStreams.incrementAndGet();
            try {
                long cursor = eventStreamer.stream(runId, lastEventId, sink);
                log.debug("SSE stream for run {} ended at #{}", runId, cursor);
                if (sink.isOpen()) {
                    emitter.complete();
                }
            } catch (RuntimeException e) {
                log.warn("SSE stream for run {} failed: {}", runId, e.getMessage());
                emitter.completeWithError(e);
            } finally {
                activeStreams.decrementAndGet();
            }
        });

        log.info("SSE emitter created for run {} after #{} (timeout={}ms)", runId, lastEventId, timeoutMs);
        return emitter;
    }

    /**
     * Returns the number of streams currently delivering events.
     */
    public int activeStreamCount() {
        return activeStreams.get();
    }

    static Map<String, Object> frame(RunEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", event.id());
        data.put("type", event.type());
        data.put("runId", event.runId());
        data.put("timestamp", event.timestamp().toString());
        data.put("data", event.data());
        return data;
    }

    static final class EmitterSink implements EventSink {

        private final String runId;
        private final SseEmitter emitter;
        private final AtomicBoolean open = new AtomicBoolean(true);

        EmitterSink(String runId, SseEmitter emitter) {
            this.runId = runId;
            this.emitter = emitter;
        }

        @Override
        public void send(RunEvent event) throws IOException {
            try {
                emitter.send(SseEmitter.event()
                        .id(Long.toString(event.id()))
                        .name(event.type())
                        .data(frame(event)));
            } catch (IllegalStateException e) {
                // emitter already completed or timed out
                close();
                throw new IOException("Emitter for run " + runId + " is closed", e);
            }
        }

        @Override
        public void heartbeat(String runId, Instant at) throws IOException {
            try {
                emitter.send(SseEmitter.event().comment("heartbeat " + at));
            } catch (IllegalStateException e) {
                close();
                throw new IOException("Emitter for run " + runId + " is closed", e);
            }
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        void close() {
            open.set(false);
        }
    }
}
