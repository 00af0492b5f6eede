package com.talewright.core.search;

import java.util.List;
import java.util.Map;

/**
 * Nearest-neighbour lookup used to ground prompts in earlier characters, world facts and scenes.
 */
public interface SemanticSearch {

    /**
     * Indexes a document.
     *
     * @return the document id
     */
    String store(String text, Map<String, String> metadata);

    /**
     * Returns up to {@code topK} documents most similar to {@code query} whose metadata contains
     * every entry of {@code filter}.
     */
    List<SearchHit> search(String query, int topK, Map<String, String> filter);

    /**
     * Drops every document whose metadata contains every entry of {@code filter}.
     *
     * @return how many documents were dropped
     */
    int delete(Map<String, String> filter);

    default List<SearchHit> search(String query, int topK) {
        return search(query, topK, Map.of());
    }
}
