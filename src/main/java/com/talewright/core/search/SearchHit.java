package com.talewright.core.search;

import java.util.Map;

/**
 * One result of a semantic search.
 *
 * @param id       document id returned by {@link SemanticSearch#store}
 * @param score    similarity in [0, 1], higher is closer
 * @param metadata metadata the document was stored with
 * @param text     stored text
 */
public record SearchHit(String id, double score, Map<String, String> metadata, String text) {
}
