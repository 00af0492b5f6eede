package com.talewright.core.events;

import java.util.Set;

/**
 * Event type names published during a run.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String GENERATION_STARTED = "generation_started";
    public static final String GENERATION_COMPLETED = "generation_completed";
    public static final String GENERATION_CANCELLED = "generation_cancelled";
    public static final String ERROR = "ERROR";

    public static final String PHASE_START = "phase_start";
    public static final String PHASE_COMPLETE = "phase_complete";

    public static final String SCENE_DRAFT_START = "scene_draft_start";
    public static final String SCENE_DRAFT_COMPLETE = "scene_draft_complete";
    public static final String SCENE_EXPANSION_COMPLETE = "scene_expansion_complete";
    public static final String SCENE_CRITIQUE_START = "scene_critique_start";
    public static final String SCENE_CRITIQUE_COMPLETE = "scene_critique_complete";
    public static final String SCENE_REVISION_START = "scene_revision_start";
    public static final String SCENE_REVISION_COMPLETE = "scene_revision_complete";
    public static final String ARCHIVIST_START = "archivist_start";
    public static final String ARCHIVIST_COMPLETE = "archivist_complete";
    public static final String SCENE_POLISH_START = "scene_polish_start";
    public static final String SCENE_POLISH_COMPLETE = "scene_polish_complete";
    public static final String SCENE_POLISH_REJECTED = "scene_polish_rejected";
    public static final String SCENE_FINAL = "scene_final";

    public static final String RUN_PAUSED = "run_paused";
    public static final String RUN_RESUMED = "run_resumed";
    public static final String RUN_CANCELLED = "run_cancelled";
    public static final String SHUTDOWN_INITIATED = "shutdown_initiated";
    public static final String RUN_RESTORED = "run_restored";

    /** Transport keep-alive; sent to stream clients, never appended to the log. */
    public static final String HEARTBEAT = "heartbeat";

    /** Types after which a stream is closed by the server. */
    public static final Set<String> TERMINAL = Set.of(ERROR, GENERATION_COMPLETED, GENERATION_CANCELLED);
}
