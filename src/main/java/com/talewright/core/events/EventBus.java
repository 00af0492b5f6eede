package com.talewright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * In-memory, per-run ordered event log with pull and push delivery.
 * <p>
 * Every published event is appended atomically to its run's log and stamped with the next
 * per-run id. Readers either pull with {@link #poll(String, long, Duration)}, which blocks until
 * an event newer than the caller's cursor exists or the timeout elapses, or register a push
 * callback with {@link #subscribe(String, Consumer)}. Two consecutive polls that pass the id of
 * the last event they received never miss an event in between.
 * <p>
 * Logs are bounded: once a run holds more than {@code maxEventsPerRun} events the oldest are
 * dropped. Ids keep increasing across trims.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int DEFAULT_MAX_EVENTS_PER_RUN = 1000;

    private final int maxEventsPerRun;

    private final ConcurrentHashMap<String, RunLog> logs = new ConcurrentHashMap<>();

    /** Per-run push subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RunEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all runs. */
    private final CopyOnWriteArrayList<Consumer<RunEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public EventBus() {
        this(DEFAULT_MAX_EVENTS_PER_RUN);
    }

    @Autowired
    public EventBus(EventBusProperties properties) {
        this(properties.getMaxEventsPerRun());
    }

    EventBus(int maxEventsPerRun) {
        this.maxEventsPerRun = maxEventsPerRun;
    }

    /**
     * Appends an event to the run's log and notifies subscribers.
     *
     * @param runId the run the event belongs to
     * @param type  event type
     * @param data  payload (copied; may be empty)
     * @return the stored event with its assigned id
     */
    public RunEvent publish(String runId, String type, Map<String, Object> data) {
        RunLog runLog = logFor(runId);
        // The publish monitor keeps push delivery in id order when several threads publish for one run.
        synchronized (runLog.publishMonitor) {
            RunEvent event = runLog.append(runId, type, data, maxEventsPerRun);
            log.debug("Published event #{} {} for run {}", event.id(), type, runId);

            List<Consumer<RunEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                for (Consumer<RunEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
            for (Consumer<RunEvent> subscriber : globalSubscribers) {
                deliverSafely(subscriber, event);
            }
            return event;
        }
    }

    /**
     * Returns all retained events of the run with an id greater than {@code afterId}, without blocking.
     */
    public List<RunEvent> read(String runId, long afterId) {
        RunLog runLog = logs.get(runId);
        return runLog == null ? List.of() : runLog.after(afterId);
    }

    /**
     * Blocks until at least one event with an id greater than {@code afterId} exists for the run,
     * or until {@code timeout} elapses.
     *
     * @return the new events in id order, or an empty list on timeout or interruption
     */
    public List<RunEvent> poll(String runId, long afterId, Duration timeout) {
        RunLog runLog = logs.get(runId);
        return runLog == null ? List.of() : runLog.await(afterId, timeout);
    }

    /**
     * Whether the bus holds a log for the run. A log exists from the run's first event until
     * {@link #evict(String)}.
     */
    public boolean isTracked(String runId) {
        return logs.containsKey(runId);
    }

    /**
     * Drops the run's log and its push subscribers. Readers still waiting in {@link #poll} are
     * woken and get nothing.
     *
     * @return false if the bus held nothing for the run
     */
    public boolean evict(String runId) {
        RunLog removed = logs.remove(runId);
        boolean hadSubscribers = runSubscribers.remove(runId) != null;
        if (removed != null) {
            removed.close();
            log.debug("Evicted event log of run {} (last id #{})", runId, removed.lastId());
        }
        return removed != null || hadSubscribers;
    }

    /**
     * Id of the last event published for the run, or 0 if none.
     */
    public long lastEventId(String runId) {
        RunLog runLog = logs.get(runId);
        return runLog == null ? 0 : runLog.lastId();
    }

    /**
     * Makes the run's next event id start after {@code lastEventId}. Used when a run is restored
     * in a fresh process so ids already seen by clients are not reused. Starts tracking the run.
     */
    public void seedSequence(String runId, long lastEventId) {
        logFor(runId).seed(lastEventId);
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @param runId    the run to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<RunEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> {
            CopyOnWriteArrayList<Consumer<RunEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all runs (global subscription).
     */
    public Subscription subscribeAll(Consumer<RunEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private RunLog logFor(String runId) {
        return logs.computeIfAbsent(runId, k -> new RunLog());
    }

    private void deliverSafely(Consumer<RunEvent> subscriber, RunEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type(), e.getMessage(), e);
        }
    }

    /**
     * One run's bounded log. Appends and reads are guarded by {@code lock}; waiting readers park on
     * {@code appended}.
     */
    private static final class RunLog {

        private final Object publishMonitor = new Object();
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition appended = lock.newCondition();
        private final Deque<RunEvent> events = new ArrayDeque<>();
        private long lastId;
        private boolean closed;

        RunEvent append(String runId, String type, Map<String, Object> data, int maxEvents) {
            lock.lock();
            try {
                RunEvent event = new RunEvent(++lastId, type, runId, Instant.now(),
                        data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data)));
                events.addLast(event);
                if (maxEvents > 0) {
                    while (events.size() > maxEvents) {
                        events.removeFirst();
                    }
                }
                appended.signalAll();
                return event;
            } finally {
                lock.unlock();
            }
        }

        List<RunEvent> after(long afterId) {
            lock.lock();
            try {
                return collectAfter(afterId);
            } finally {
                lock.unlock();
            }
        }

        List<RunEvent> await(long afterId, Duration timeout) {
            lock.lock();
            try {
                long remaining = timeout.toNanos();
                while (lastId <= afterId && remaining > 0 && !closed) {
                    remaining = appended.awaitNanos(remaining);
                }
                return collectAfter(afterId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            } finally {
                lock.unlock();
            }
        }

        void close() {
            lock.lock();
            try {
                closed = true;
                appended.signalAll();
            } finally {
                lock.unlock();
            }
        }

        long lastId() {
            lock.lock();
            try {
                return lastId;
            } finally {
                lock.unlock();
            }
        }

        void seed(long id) {
            lock.lock();
            try {
                if (id > lastId) {
                    lastId = id;
                }
            } finally {
                lock.unlock();
            }
        }

        private List<RunEvent> collectAfter(long afterId) {
            if (lastId <= afterId) {
                return List.of();
            }
            List<RunEvent> result = new ArrayList<>();
            for (RunEvent event : events) {
                if (event.id() > afterId) {
                    result.add(event);
                }
            }
            return result;
        }
    }

    // Visible for tests.
    int retainedCount(String runId) {
        RunLog runLog = logs.get(runId);
        if (runLog == null) {
            return 0;
        }
        return runLog.after(0).size();
    }
}
