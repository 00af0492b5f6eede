package com.talewright.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The Profiler's cast.
 */
public record CharacterRoster(
    @JsonProperty("characters") @JsonAlias("items") List<CharacterProfile> characters
) {

    public CharacterRoster {
        characters = characters == null ? List.of() : characters;
    }

    public record CharacterProfile(
        @JsonProperty("name") String name,
        @JsonProperty("role") String role,
        @JsonProperty("description") String description,
        @JsonProperty("motivation") String motivation,
        @JsonProperty("voice") String voice,
        @JsonProperty("relationships") String relationships
    ) {}
}
