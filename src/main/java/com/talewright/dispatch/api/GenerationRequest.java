package com.talewright.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/runs.
 *
 * @param projectId   project the run belongs to; nullable
 * @param seedIdea    the story idea to develop; required
 * @param model       model identifier; nullable, defaults to the configured model
 * @param temperature sampling temperature; nullable, defaults to the configured temperature
 */
public record GenerationRequest(
    @JsonProperty("project_id") String projectId,
    @JsonProperty("seed_idea") String seedIdea,
    String model,
    Double temperature
) {}
