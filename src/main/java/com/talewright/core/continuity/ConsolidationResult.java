package com.talewright.core.continuity;

import com.talewright.core.model.Constraint;

import java.util.List;

/**
 * Outcome of merging candidate constraints into a run's store.
 *
 * @param accepted candidates appended to the store
 * @param rejected candidates refused (anchored key, stale scene, unknown entity or empty value)
 */
public record ConsolidationResult(List<Constraint> accepted, List<Constraint> rejected) {
}
