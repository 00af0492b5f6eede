package com.talewright.core.persistence;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ArtifactStore}. Contents are lost on restart, so snapshots only survive
 * within the same JVM (enough for tests and local runs).
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private final ConcurrentHashMap<Key, StoredArtifact> artifacts = new ConcurrentHashMap<>();

    @Override
    public void put(String runId, String artifactType, String content) {
        artifacts.put(new Key(runId, artifactType), new StoredArtifact(runId, artifactType, content, Instant.now()));
    }

    @Override
    public Optional<StoredArtifact> get(String runId, String artifactType) {
        return Optional.ofNullable(artifacts.get(new Key(runId, artifactType)));
    }

    @Override
    public boolean delete(String runId, String artifactType) {
        return artifacts.remove(new Key(runId, artifactType)) != null;
    }

    @Override
    public List<StoredArtifact> listByType(String artifactType) {
        return artifacts.values().stream()
                .filter(a -> a.artifactType().equals(artifactType))
                .sorted(Comparator.comparing(StoredArtifact::updatedAt))
                .toList();
    }

    private record Key(String runId, String artifactType) {}
}
