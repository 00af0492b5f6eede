package com.talewright.core.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySemanticSearchTest {

    private final InMemorySemanticSearch search = new InMemorySemanticSearch();

    @Test
    @DisplayName("ranks the closest document first")
    void ranksBySimilarity() {
        search.store("The lighthouse keeper climbs the spiral stairs", Map.of("kind", "scene"));
        search.store("A merchant counts coins in the market", Map.of("kind", "scene"));

        List<SearchHit> hits = search.search("lighthouse stairs", 5, Map.of());

        assertEquals(1, hits.size());
        assertTrue(hits.get(0).text().contains("lighthouse"));
        assertTrue(hits.get(0).score() > 0 && hits.get(0).score() <= 1.0);
    }

    @Test
    @DisplayName("applies the metadata filter")
    void filtersByMetadata() {
        search.store("storm over the harbor", Map.of("runId", "R-1"));
        search.store("storm over the harbor", Map.of("runId", "R-2"));

        List<SearchHit> hits = search.search("harbor storm", 5, Map.of("runId", "R-2"));

        assertEquals(1, hits.size());
        assertEquals("R-2", hits.get(0).metadata().get("runId"));
    }

    @Test
    @DisplayName("honours topK and returns nothing for an empty query")
    void topKAndEmptyQuery() {
        for (int i = 0; i < 4; i++) {
            search.store("harbor scene " + i, Map.of());
        }

        assertEquals(2, search.search("harbor", 2, Map.of()).size());
        assertTrue(search.search("", 5, Map.of()).isEmpty());
        assertEquals(4, search.size());
    }

    @Test
    @DisplayName("deletes only the documents matching the filter")
    void deletesByFilter() {
        search.store("storm over the harbor", Map.of("runId", "R-1", "kind", "scene"));
        search.store("the keeper's ledger", Map.of("runId", "R-1", "kind", "character"));
        search.store("storm over the harbor", Map.of("runId", "R-2", "kind", "scene"));

        assertEquals(2, search.delete(Map.of("runId", "R-1")));

        assertEquals(1, search.size());
        assertTrue(search.search("harbor storm", 5, Map.of("runId", "R-1")).isEmpty());
        assertEquals(0, search.delete(Map.of("runId", "R-1")));
    }
}
