package com.talewright.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The Strategist's ordered scene plan.
 */
public record ScenePlan(
    @JsonProperty("scenes") @JsonAlias("items") List<PlannedScene> scenes
) {

    public ScenePlan {
        scenes = scenes == null ? List.of() : scenes;
    }

    public record PlannedScene(
        @JsonProperty("title") String title,
        @JsonProperty("summary") String summary,
        @JsonProperty("characters") List<String> characters,
        @JsonProperty("target_word_count") @JsonAlias("targetWordCount") Integer targetWordCount
    ) {}
}
