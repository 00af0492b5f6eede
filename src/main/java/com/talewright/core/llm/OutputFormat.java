package com.talewright.core.llm;

/**
 * Expected shape of an agent's reply.
 */
public enum OutputFormat {
    /** A single JSON object (a top-level array is wrapped as {@code {"items": [...]}}). */
    JSON,
    /** Plain prose. */
    PROSE
}
