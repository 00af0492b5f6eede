package com.talewright.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Facts the Archivist reports as changed or newly established after a scene.
 */
public record ConstraintUpdates(
    @JsonProperty("constraints") @JsonAlias("items") List<ConstraintUpdate> constraints
) {

    public ConstraintUpdates {
        constraints = constraints == null ? List.of() : constraints;
    }

    /**
     * @param scene scene the fact was established in, or {@code null} for the scene just written
     */
    public record ConstraintUpdate(
        @JsonProperty("key") String key,
        @JsonProperty("value") String value,
        @JsonProperty("scene") @JsonAlias("sceneNumber") Integer scene,
        @JsonProperty("reasoning") String reasoning
    ) {}
}
