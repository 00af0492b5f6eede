package com.talewright.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The Architect's story concept.
 */
public record StoryConcept(
    @JsonProperty("title") String title,
    @JsonProperty("logline") String logline,
    @JsonProperty("genre") String genre,
    @JsonProperty("tone") String tone,
    @JsonProperty("premise") String premise,
    @JsonProperty("protagonist") String protagonist,
    @JsonProperty("setting") String setting,
    @JsonProperty("theme") String theme,
    @JsonProperty("point_of_view") @JsonAlias("pointOfView") String pointOfView,
    @JsonProperty("central_conflict") @JsonAlias("centralConflict") String centralConflict
) {

    /**
     * Concept fields anchored as immutable constraints, keyed by constraint key. Blank fields are left out.
     */
    public Map<String, String> anchors() {
        Map<String, String> anchors = new LinkedHashMap<>();
        putIfPresent(anchors, "world_genre", genre);
        putIfPresent(anchors, "world_tone", tone);
        putIfPresent(anchors, "plot_premise", premise);
        putIfPresent(anchors, "plot_protagonist", protagonist);
        putIfPresent(anchors, "world_setting", setting);
        putIfPresent(anchors, "plot_theme", theme);
        putIfPresent(anchors, "world_point_of_view", pointOfView);
        return anchors;
    }

    private static void putIfPresent(Map<String, String> anchors, String key, String value) {
        if (value != null && !value.isBlank()) {
            anchors.put(key, value.strip());
        }
    }
}
