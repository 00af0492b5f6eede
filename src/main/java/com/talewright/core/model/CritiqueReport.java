package com.talewright.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A Critic reply as the model wrote it. Any of the verdict fields may be missing; see
 * {@link #toCritique(double)}.
 */
public record CritiqueReport(
    @JsonProperty("score") @JsonAlias("overall_score") Double score,
    @JsonProperty("revision_needed") @JsonAlias("revisionNeeded") Boolean revisionNeeded,
    @JsonProperty("approved") Boolean approved,
    @JsonProperty("strengths") List<String> strengths,
    @JsonProperty("issues") List<String> issues,
    @JsonProperty("revision_requests") @JsonAlias("revisionRequests") List<String> revisionRequests,
    @JsonProperty("feedback") String feedback
) {

    /**
     * The verdict. An explicit {@code revision_needed} wins, then {@code approved}, then the score
     * against {@code approvalScore}; a reply with none of them asks for revision.
     */
    public Critique toCritique(double approvalScore) {
        boolean needsRevision;
        if (revisionNeeded != null) {
            needsRevision = revisionNeeded;
        } else if (approved != null) {
            needsRevision = !approved;
        } else if (score != null) {
            needsRevision = score < approvalScore;
        } else {
            needsRevision = true;
        }
        return new Critique(score == null ? 0 : score, needsRevision, nonBlank(strengths), nonBlank(issues),
                nonBlank(revisionRequests), feedback == null ? "" : feedback);
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(v -> v != null && !v.isBlank()).toList();
    }
}
