package com.talewright.core.engine;

import com.talewright.core.state.RunState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The runs known to this process, keyed by run id. Terminal runs stay registered, so their final
 * state remains queryable, until the lifecycle manager evicts them after their retention period.
 */
@Component
public class RunRegistry {

    private final ConcurrentHashMap<String, RunHandle> runs = new ConcurrentHashMap<>();

    /**
     * Registers a run.
     *
     * @param initialCheckpoint serialized state to fall back to before the first checkpoint
     * @throws IllegalStateException if a run with the same id is already registered
     */
    public RunHandle create(RunState state, String initialCheckpoint) {
        RunHandle handle = new RunHandle(state, initialCheckpoint);
        RunHandle existing = runs.putIfAbsent(state.getRunId(), handle);
        if (existing != null) {
            throw new IllegalStateException("Run " + state.getRunId() + " is already registered");
        }
        return handle;
    }

    public Optional<RunHandle> get(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public boolean remove(String runId) {
        return runs.remove(runId) != null;
    }

    /** All registered runs, oldest start first. */
    public List<RunHandle> listAll() {
        List<RunHandle> all = new ArrayList<>(runs.values());
        all.sort((a, b) -> {
            var left = a.state().getStartedAt();
            var right = b.state().getStartedAt();
            if (left == null || right == null) {
                return a.runId().compareTo(b.runId());
            }
            return left.compareTo(right);
        });
        return all;
    }
}
