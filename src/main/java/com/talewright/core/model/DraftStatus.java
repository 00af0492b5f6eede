package com.talewright.core.model;

/**
 * Progress of a scene through the drafting loop.
 */
public enum DraftStatus {
    DRAFTED,
    REVISED,
    ACCEPTED,
    FINAL
}
