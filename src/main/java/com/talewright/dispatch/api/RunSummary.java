package com.talewright.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.talewright.core.model.SceneDraft;
import com.talewright.core.state.RunState;

import java.time.Instant;

/**
 * JSON response for run endpoints.
 */
public record RunSummary(
    @JsonProperty("run_id") String runId,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("seed_idea") String seedIdea,
    String status,
    String phase,
    @JsonProperty("current_scene") int currentScene,
    @JsonProperty("total_scenes") int totalScenes,
    @JsonProperty("word_count") int wordCount,
    @JsonProperty("total_revisions") int totalRevisions,
    @JsonProperty("constraint_count") int constraintCount,
    String model,
    String error,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public static RunSummary from(RunState state) {
        return new RunSummary(
                state.getRunId(),
                state.getProjectId(),
                state.getSeedIdea(),
                state.status().name(),
                state.getPhase().key(),
                state.getCurrentScene(),
                state.getTotalScenes(),
                state.getDrafts().values().stream().mapToInt(SceneDraft::wordCount).sum(),
                state.getRevisionCount().values().stream().mapToInt(Integer::intValue).sum(),
                state.getKeyConstraints().size(),
                state.getModelConfig() != null ? state.getModelConfig().model() : null,
                state.getError(),
                state.getStartedAt(),
                state.getUpdatedAt()
        );
    }
}
