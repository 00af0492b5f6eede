package com.talewright.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link ArtifactStore}.
 * <p>
 * One row per {@code (run_id, artifact_type)}; writes are upserts. The table
 * {@code talewright_artifacts} is created by {@link #createTables()}.
 */
public class JdbcArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcArtifactStore.class);

    private static final String TABLE_NAME = "talewright_artifacts";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                run_id        VARCHAR(255) NOT NULL,
                artifact_type VARCHAR(255) NOT NULL,
                content       TEXT NOT NULL,
                updated_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (run_id, artifact_type)
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (run_id, artifact_type, content)
            VALUES (?, ?, ?)
            ON CONFLICT (run_id, artifact_type)
            DO UPDATE SET content = EXCLUDED.content,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT run_id, artifact_type, content, updated_at
            FROM %s
            WHERE run_id = ? AND artifact_type = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_TYPE_SQL = """
            SELECT run_id, artifact_type, content, updated_at
            FROM %s
            WHERE artifact_type = ?
            ORDER BY updated_at ASC
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE run_id = ? AND artifact_type = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcArtifactStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the artifact table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Artifact table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void put(String runId, String artifactType, String content) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, runId);
            stmt.setString(2, artifactType);
            stmt.setString(3, content);
            stmt.executeUpdate();
            log.debug("Saved artifact {} for run {} ({} chars)", artifactType, runId, content.length());
        } catch (SQLException e) {
            throw new StorageException("Failed to save artifact " + artifactType + " for run " + runId, e);
        }
    }

    @Override
    public Optional<StoredArtifact> get(String runId, String artifactType) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, runId);
            stmt.setString(2, artifactType);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load artifact " + artifactType + " for run " + runId, e);
        }
    }

    @Override
    public boolean delete(String runId, String artifactType) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, runId);
            stmt.setString(2, artifactType);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete artifact " + artifactType + " for run " + runId, e);
        }
    }

    @Override
    public List<StoredArtifact> listByType(String artifactType) {
        List<StoredArtifact> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_TYPE_SQL)) {
            stmt.setString(1, artifactType);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list artifacts of type " + artifactType, e);
        }
        return result;
    }

    private static StoredArtifact fromResultSet(ResultSet rs) throws SQLException {
        Timestamp updated = rs.getTimestamp("updated_at");
        return new StoredArtifact(
                rs.getString("run_id"),
                rs.getString("artifact_type"),
                rs.getString("content"),
                updated != null ? updated.toInstant() : null);
    }
}
