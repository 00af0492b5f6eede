package com.talewright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of one Critic pass over a scene draft.
 * <p>
 * Approval is {@code revisionNeeded == false}.
 *
 * @param score            overall score 0-10
 * @param revisionNeeded   whether the Critic asks for another revision
 * @param strengths        what works
 * @param issues           problems found
 * @param revisionRequests concrete change requests for the Writer
 * @param feedback         free-form summary
 */
public record Critique(
    double score,
    boolean revisionNeeded,
    List<String> strengths,
    List<String> issues,
    List<String> revisionRequests,
    String feedback
) implements Serializable {

    public boolean approved() {
        return !revisionNeeded;
    }
}
