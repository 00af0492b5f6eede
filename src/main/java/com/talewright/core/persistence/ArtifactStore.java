package com.talewright.core.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Durable record store for run artifacts and shutdown snapshots, keyed by {@code (runId, artifactType)}.
 * <p>
 * Implementations throw {@link StorageException} when the backend is unreachable.
 */
public interface ArtifactStore {

    /** Type under which shutdown snapshots are saved. */
    String RUN_STATE_SNAPSHOT = "run_state_snapshot";

    void put(String runId, String artifactType, String content);

    Optional<StoredArtifact> get(String runId, String artifactType);

    /**
     * @return true if an artifact was removed
     */
    boolean delete(String runId, String artifactType);

    /** All artifacts of one type across runs, oldest first. */
    List<StoredArtifact> listByType(String artifactType);
}
