package com.talewright.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Latest draft text of a scene plus bookkeeping.
 *
 * @param sceneNumber    scene this draft belongs to
 * @param content        prose text
 * @param wordCount      word count computed by the engine
 * @param writerAttempts number of Writer calls that produced or revised this text (draft = 1)
 * @param status         loop position of the scene
 * @param approved       whether the latest critique approved the text
 * @param polished       whether the canonical text came out of a validated polish pass
 * @param updatedAt      last modification time
 */
public record SceneDraft(
    int sceneNumber,
    String content,
    int wordCount,
    int writerAttempts,
    DraftStatus status,
    boolean approved,
    boolean polished,
    Instant updatedAt
) implements Serializable {

    public SceneDraft withContent(String newContent, int newWordCount, DraftStatus newStatus, Instant now) {
        return new SceneDraft(sceneNumber, newContent, newWordCount, writerAttempts + 1, newStatus, approved, polished, now);
    }

    public SceneDraft extendedWith(String newContent, int newWordCount, Instant now) {
        return new SceneDraft(sceneNumber, newContent, newWordCount, writerAttempts, status, approved, polished, now);
    }

    public SceneDraft finalized(String canonical, int canonicalWordCount, boolean approvedFinal, boolean polishedFinal,
                                Instant now) {
        return new SceneDraft(sceneNumber, canonical, canonicalWordCount, writerAttempts, DraftStatus.FINAL,
                approvedFinal, polishedFinal, now);
    }

    public SceneDraft accepted(boolean approvedFinal, Instant now) {
        return new SceneDraft(sceneNumber, content, wordCount, writerAttempts, DraftStatus.ACCEPTED, approvedFinal,
                polished, now);
    }
}
