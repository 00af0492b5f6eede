package com.talewright.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The Worldbuilder's places, cultures and rules.
 */
public record WorldBible(
    @JsonProperty("elements") @JsonAlias("items") List<WorldElement> elements,
    @JsonProperty("rules") List<String> rules
) {

    public WorldBible {
        elements = elements == null ? List.of() : elements;
        rules = rules == null ? List.of() : rules;
    }

    /**
     * @param category location, culture, history, technology, magic or other
     */
    public record WorldElement(
        @JsonProperty("name") String name,
        @JsonProperty("category") String category,
        @JsonProperty("description") String description
    ) {}
}
