package com.talewright.core.engine;

import com.talewright.core.events.EventBus;
import com.talewright.core.events.EventTypes;
import com.talewright.core.llm.LlmProperties;
import com.talewright.core.metrics.TalewrightMetrics;
import com.talewright.core.model.ModelConfig;
import com.talewright.core.model.RunStatus;
import com.talewright.core.persistence.ArtifactStore;
import com.talewright.core.persistence.StoredArtifact;
import com.talewright.core.search.SemanticSearch;
import com.talewright.core.state.RunSnapshot;
import com.talewright.core.state.RunState;
import com.talewright.core.state.RunStateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifecycle control surface for runs: start, status, pause, resume, cancel, graceful shutdown and
 * restore after restart.
 * <p>
 * Pause and cancel are cooperative. They set a flag on the run's state that the execution samples
 * at its next checkpoint; an in-flight agent call is never interrupted. Each run has at most one
 * execution at a time, enforced by the claim on its {@link RunHandle}.
 * <p>
 * Once a run ends its indexed documents are dropped at once. Its handle and event log stay for
 * {@code talewright.lifecycle.terminal-retention} so late readers can still fetch the final state
 * and replay the stream, then both are evicted.
 */
@Service
public class RunLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(RunLifecycleManager.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final RunRegistry registry;
    private final PhaseEngine engine;
    private final EventBus eventBus;
    private final ArtifactStore artifactStore;
    private final RunStateCodec codec;
    private final TalewrightMetrics metrics;
    private final LlmProperties llmProperties;
    private final SemanticSearch search;
    private final LifecycleProperties lifecycleProperties;

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "talewright-run-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final ScheduledExecutorService reaper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "talewright-reaper");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean shuttingDown;

    public RunLifecycleManager(RunRegistry registry, PhaseEngine engine, EventBus eventBus,
                               ArtifactStore artifactStore, RunStateCodec codec, TalewrightMetrics metrics,
                               LlmProperties llmProperties, SemanticSearch search,
                               LifecycleProperties lifecycleProperties) {
        this.registry = registry;
        this.engine = engine;
        this.eventBus = eventBus;
        this.artifactStore = artifactStore;
        this.codec = codec;
        this.metrics = metrics;
        this.llmProperties = llmProperties;
        this.search = search;
        this.lifecycleProperties = lifecycleProperties;
    }

    /**
     * Registers a new run and starts executing it in the background.
     *
     * @param modelConfig model selection, or {@code null} for the configured default
     * @return the new run id
     * @throws IllegalArgumentException if the seed idea is blank
     * @throws IllegalStateException    after {@link #gracefulShutdown(Duration)}
     */
    public String startGeneration(String projectId, String seedIdea, ModelConfig modelConfig) {
        if (shuttingDown) {
            throw new IllegalStateException("Shutting down; no new runs are accepted");
        }
        if (seedIdea == null || seedIdea.isBlank()) {
            throw new IllegalArgumentException("Seed idea is required");
        }
        ModelConfig model = modelConfig != null && modelConfig.model() != null && !modelConfig.model().isBlank()
                ? modelConfig
                : new ModelConfig(llmProperties.getModel(), llmProperties.getTemperature());
        String runId = generateRunId();
        RunState state = RunState.create(runId, projectId, seedIdea.strip(), model, Instant.now());
        RunHandle handle = registry.create(state, codec.toJson(state));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("projectId", projectId == null ? "" : projectId);
        data.put("seedIdea", state.getSeedIdea());
        data.put("model", model.model());
        eventBus.publish(runId, EventTypes.GENERATION_STARTED, data);
        log.info("Accepted run {} for project {} (model={})", runId, projectId, model.model());

        handle.tryClaim();
        launch(handle);
        return runId;
    }

    /**
     * A deep copy of the run's current state.
     */
    public Optional<RunState> getRunStatus(String runId) {
        return registry.get(runId).map(handle -> codec.copy(handle.state()));
    }

    /**
     * Requests a pause at the run's next checkpoint.
     *
     * @return false if the run is unknown, already paused, or terminal
     */
    public boolean pauseRun(String runId) {
        Optional<RunHandle> found = registry.get(runId);
        if (found.isEmpty()) {
            return false;
        }
        RunState state = found.get().state();
        synchronized (found.get()) {
            if (state.isTerminal() || state.isPaused()) {
                return false;
            }
            state.setPaused(true);
        }
        eventBus.publish(runId, EventTypes.RUN_PAUSED, position(state));
        log.info("Run {} pause requested in phase {}", runId, state.getPhase());
        return true;
    }

    /**
     * Resumes a paused or restored run from its recorded phase. If the paused execution is still
     * unwinding, it continues instead of a new one being started.
     *
     * @return false if the run is unknown, not paused, or terminal, or the process is shutting down
     */
    public boolean resumeRun(String runId) {
        if (shuttingDown) {
            return false;
        }
        Optional<RunHandle> found = registry.get(runId);
        if (found.isEmpty()) {
            return false;
        }
        RunHandle handle = found.get();
        RunState state = handle.state();
        boolean launchNew;
        synchronized (handle) {
            if (state.isTerminal() || !state.isPaused()) {
                return false;
            }
            eventBus.publish(runId, EventTypes.RUN_RESUMED, position(state));
            launchNew = handle.resumeAndClaim();
        }
        if (launchNew) {
            log.info("Resuming run {} from phase {}", runId, state.getPhase());
            launch(handle);
        } else {
            log.info("Run {} resumed while its execution was still stopping", runId);
        }
        return true;
    }

    /**
     * Cancels the run. A running execution stops at its next checkpoint and publishes
     * {@code generation_cancelled}; an idle (paused) run is cancelled immediately.
     *
     * @return false if the run is unknown or already terminal
     */
    public boolean cancelRun(String runId) {
        Optional<RunHandle> found = registry.get(runId);
        if (found.isEmpty()) {
            return false;
        }
        RunHandle handle = found.get();
        RunState state = handle.state();
        synchronized (handle) {
            if (state.isTerminal()) {
                return false;
            }
            state.setCancelled(true);
        }
        eventBus.publish(runId, EventTypes.RUN_CANCELLED, position(state));
        log.info("Run {} cancel requested in phase {}", runId, state.getPhase());

        if (handle.tryClaim()) {
            eventBus.publish(runId, EventTypes.GENERATION_CANCELLED, position(state));
            metrics.recordRunResult(RunStatus.CANCELLED.name());
            retire(handle);
            handle.releaseOrKeepForResume(false);
        }
        return true;
    }

    /**
     * Deep copies of every run that is not completed, failed or cancelled.
     */
    public List<RunState> listActiveRuns() {
        return registry.listAll().stream()
                .filter(handle -> !handle.state().isTerminal())
                .map(handle -> codec.copy(handle.state()))
                .toList();
    }

    /**
     * Waits until the run has no execution.
     *
     * @return true if idle, false if unknown or the timeout elapsed
     */
    public boolean awaitIdle(String runId, Duration timeout) throws InterruptedException {
        Optional<RunHandle> found = registry.get(runId);
        if (found.isEmpty()) {
            return false;
        }
        return found.get().awaitIdle(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Pauses every active run, waits up to {@code timeout} for their executions to reach a
     * checkpoint, and saves each run as a {@value ArtifactStore#RUN_STATE_SNAPSHOT} artifact. A
     * run still executing when the timeout elapses is saved in its last checkpointed state.
     * Afterwards no new run is accepted.
     *
     * @return number of runs saved
     */
    public int gracefulShutdown(Duration timeout) {
        shuttingDown = true;
        List<RunHandle> active = registry.listAll().stream()
                .filter(handle -> !handle.state().isTerminal())
                .toList();
        log.info("Graceful shutdown: pausing {} active run(s)", active.size());
        for (RunHandle handle : active) {
            handle.state().setPaused(true);
            eventBus.publish(handle.runId(), EventTypes.SHUTDOWN_INITIATED, position(handle.state()));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        boolean interrupted = false;
        for (RunHandle handle : active) {
            long remaining = deadline - System.nanoTime();
            if (interrupted || remaining <= 0) {
                break;
            }
            try {
                if (!handle.awaitIdle(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Run {} did not reach a checkpoint in time; saving its last checkpoint", handle.runId());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
            }
        }

        int saved = 0;
        for (RunHandle handle : active) {
            try {
                RunState snapshotState = handle.isExecuting()
                        ? codec.fromJson(handle.lastCheckpoint())
                        : codec.copy(handle.state());
                snapshotState.setPaused(true);
                RunSnapshot snapshot = new RunSnapshot(snapshotState, eventBus.lastEventId(handle.runId()), Instant.now());
                artifactStore.put(handle.runId(), ArtifactStore.RUN_STATE_SNAPSHOT, codec.snapshotToJson(snapshot));
                saved++;
            } catch (RuntimeException e) {
                log.error("Failed to save snapshot for run {}", handle.runId(), e);
            }
        }
        metrics.recordSnapshots(saved);
        executor.shutdown();
        reaper.shutdownNow();
        log.info("Graceful shutdown saved {} of {} run(s)", saved, active.size());
        return saved;
    }

    /**
     * Re-registers every run saved by {@link #gracefulShutdown(Duration)} as a paused run and deletes
     * its snapshot. Restored runs wait for an explicit {@link #resumeRun(String)}.
     *
     * @return number of runs restored
     */
    public int restoreAllInterruptedRuns() {
        List<StoredArtifact> snapshots = artifactStore.listByType(ArtifactStore.RUN_STATE_SNAPSHOT);
        int restored = 0;
        for (StoredArtifact artifact : snapshots) {
            try {
                RunSnapshot snapshot = codec.snapshotFromJson(artifact.content());
                RunState state = snapshot.state();
                state.setPaused(true);
                if (registry.get(state.getRunId()).isPresent()) {
                    log.warn("Run {} is already active; discarding its snapshot", state.getRunId());
                    artifactStore.delete(artifact.runId(), ArtifactStore.RUN_STATE_SNAPSHOT);
                    continue;
                }
                registry.create(state, codec.toJson(state));
                eventBus.seedSequence(state.getRunId(), snapshot.lastEventId());
                eventBus.publish(state.getRunId(), EventTypes.RUN_RESTORED, position(state));
                artifactStore.delete(artifact.runId(), ArtifactStore.RUN_STATE_SNAPSHOT);
                restored++;
                log.info("Restored run {} in phase {} (paused)", state.getRunId(), state.getPhase());
            } catch (RuntimeException e) {
                log.error("Failed to restore snapshot of run {}", artifact.runId(), e);
            }
        }
        if (!snapshots.isEmpty()) {
            log.info("Restored {} of {} interrupted run(s)", restored, snapshots.size());
        }
        return restored;
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    private void launch(RunHandle handle) {
        CompletableFuture.runAsync(() -> runExecution(handle), executor);
    }

    private void runExecution(RunHandle handle) {
        boolean relaunch;
        do {
            RunStatus status;
            try {
                status = engine.execute(handle);
            } catch (RuntimeException e) {
                log.error("Execution of run {} ended unexpectedly", handle.runId(), e);
                status = RunStatus.FAILED;
            }
            if (status.terminal()) {
                retire(handle);
            }
            relaunch = handle.releaseOrKeepForResume(status == RunStatus.PAUSED);
            if (relaunch) {
                log.info("Run {} was resumed while stopping; continuing", handle.runId());
            }
        } while (relaunch);
    }

    /**
     * Drops the ended run's search documents and schedules its handle and event log for eviction.
     */
    private void retire(RunHandle handle) {
        String runId = handle.runId();
        try {
            int dropped = search.delete(Map.of("runId", runId));
            log.debug("Dropped {} indexed document(s) of ended run {}", dropped, runId);
        } catch (RuntimeException e) {
            log.warn("Could not drop indexed documents of run {}: {}", runId, e.getMessage());
        }
        Duration retention = lifecycleProperties.getTerminalRetention();
        if (retention == null || retention.isNegative()) {
            return;
        }
        try {
            reaper.schedule(() -> evict(handle), retention.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Not scheduling eviction of run {} during shutdown", runId);
        }
    }

    private void evict(RunHandle handle) {
        String runId = handle.runId();
        if (registry.get(runId).orElse(null) != handle) {
            return;
        }
        registry.remove(runId);
        eventBus.evict(runId);
        log.info("Evicted ended run {} after retention", runId);
    }

    private static Map<String, Object> position(RunState state) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("phase", state.getPhase().key());
        data.put("currentScene", state.getCurrentScene());
        data.put("totalScenes", state.getTotalScenes());
        return data;
    }

    /**
     * Generates a run id in the format TLWR-YYYY-NNNN-xxxx.
     */
    static String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        String suffix = UUID.randomUUID().toString().substring(0, 4);
        return String.format("TLWR-%d-%04d-%s", year, count, suffix);
    }
}
