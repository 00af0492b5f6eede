package com.talewright.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A canonical continuity fact about the story.
 * <p>
 * The {@code key} is semantic (e.g. {@code char_mara_status}) so that later facts about the same
 * subject supersede earlier ones deterministically. Constraints seeded during the concept phase
 * carry {@code sceneNumber == 0} and {@code immutable == true} and are never overwritten.
 *
 * @param key         semantic identifier
 * @param value       asserted value
 * @param source      agent that asserted the fact
 * @param sceneNumber scene in which the fact was established (0 = concept)
 * @param timestamp   when the constraint was recorded
 * @param reasoning   short justification from the asserting agent
 * @param immutable   whether later consolidation may supersede it
 */
public record Constraint(
    String key,
    String value,
    AgentRole source,
    int sceneNumber,
    Instant timestamp,
    String reasoning,
    boolean immutable
) implements Serializable {

    public static Constraint seed(String key, String value, String reasoning, Instant now) {
        return new Constraint(key, value, AgentRole.ARCHITECT, 0, now, reasoning, true);
    }

    /** True for the scene-0 immutable constraints that anchor the story against drift. */
    public boolean anchored() {
        return immutable && sceneNumber == 0;
    }
}
