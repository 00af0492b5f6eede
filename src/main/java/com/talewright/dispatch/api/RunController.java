package com.talewright.dispatch.api;

import com.talewright.core.engine.RunLifecycleManager;
import com.talewright.core.model.ModelConfig;
import com.talewright.core.model.RunStatus;
import com.talewright.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * REST controller for run lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunLifecycleManager lifecycleManager;
    private final SseStreamingService sseStreamingService;

    public RunController(RunLifecycleManager lifecycleManager, SseStreamingService sseStreamingService) {
        this.lifecycleManager = lifecycleManager;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/runs — Start a new generation. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startGeneration(@RequestBody GenerationRequest request) {
        if (request.seedIdea() == null || request.seedIdea().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "seed_idea is required"));
        }
        if (request.temperature() != null && (request.temperature() < 0 || request.temperature() > 2)) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "temperature must be between 0 and 2"));
        }

        ModelConfig modelConfig = null;
        if (request.model() != null && !request.model().isBlank()) {
            modelConfig = new ModelConfig(request.model(),
                    request.temperature() != null ? request.temperature() : 0.8);
        }

        try {
            String runId = lifecycleManager.startGeneration(request.projectId(), request.seedIdea(), modelConfig);
            log.info("Run {} submitted via API", runId);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                    "run_id", runId,
                    "status", RunStatus.RUNNING.name()
            ));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/runs — Non-terminal runs, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<RunSummary>> listActiveRuns() {
        return ResponseEntity.ok(lifecycleManager.listActiveRuns().stream()
                .map(RunSummary::from)
                .toList());
    }

    /**
     * GET /api/v1/runs/{id} — Current run position and outcome.
     */
    @GetMapping("/{id}")
    public ResponseEntity<RunSummary> getRun(@PathVariable String id) {
        return lifecycleManager.getRunStatus(id)
                .map(state -> ResponseEntity.ok(RunSummary.from(state)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/runs/{id}/events — SSE stream of the run's events.
     * A reconnecting client passes the last id it saw via {@code Last-Event-ID} or {@code lastEventId}.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(
            @PathVariable String id,
            @RequestHeader(value = "Last-Event-ID", required = false) String lastEventIdHeader,
            @RequestParam(value = "lastEventId", required = false) Long lastEventIdParam) {
        if (lifecycleManager.getRunStatus(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        long lastEventId = lastEventIdParam != null ? lastEventIdParam : parseEventId(lastEventIdHeader);
        return ResponseEntity.ok(sseStreamingService.createEmitter(id, lastEventId));
    }

    /**
     * POST /api/v1/runs/{id}/pause — Pause at the next checkpoint.
     */
    @PostMapping("/{id}/pause")
    public ResponseEntity<Map<String, String>> pauseRun(@PathVariable String id) {
        return transition(id, lifecycleManager::pauseRun, "Run cannot be paused");
    }

    /**
     * POST /api/v1/runs/{id}/resume — Resume a paused run.
     */
    @PostMapping("/{id}/resume")
    public ResponseEntity<Map<String, String>> resumeRun(@PathVariable String id) {
        return transition(id, lifecycleManager::resumeRun, "Run cannot be resumed");
    }

    /**
     * POST /api/v1/runs/{id}/cancel — Cancel a run; it stops at its next checkpoint.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancelRun(@PathVariable String id) {
        return transition(id, lifecycleManager::cancelRun, "Run cannot be cancelled");
    }

    private ResponseEntity<Map<String, String>> transition(String id, Predicate<String> action, String refusal) {
        Optional<RunState> before = lifecycleManager.getRunStatus(id);
        if (before.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!action.test(id)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "run_id", id,
                    "status", before.get().status().name(),
                    "error", refusal
            ));
        }
        String status = lifecycleManager.getRunStatus(id)
                .map(state -> state.status().name())
                .orElse(before.get().status().name());
        return ResponseEntity.ok(Map.of("run_id", id, "status", status));
    }

    private static long parseEventId(String header) {
        if (header == null || header.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed Last-Event-ID header: {}", header);
            return 0;
        }
    }
}
