package com.talewright.core.persistence;

import java.time.Instant;

/**
 * A persisted artifact.
 *
 * @param runId        owning run
 * @param artifactType artifact name (phase output, scene, or snapshot)
 * @param content      JSON or text content
 * @param updatedAt    last write time
 */
public record StoredArtifact(String runId, String artifactType, String content, Instant updatedAt) {
}
