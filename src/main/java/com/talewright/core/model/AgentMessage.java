package com.talewright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One agent turn recorded in a run's audit trail.
 *
 * @param sender    agent that produced the message
 * @param recipient addressed agent, or {@code null} for a broadcast
 * @param type      kind of turn
 * @param content   text content (possibly truncated for long prose)
 * @param artifact  optional structured payload
 * @param phase     phase during which the turn happened
 * @param sceneNumber scene the turn belongs to, 0 outside drafting
 * @param timestamp when the turn was recorded
 */
public record AgentMessage(
    AgentRole sender,
    AgentRole recipient,
    MessageType type,
    String content,
    Map<String, Object> artifact,
    Phase phase,
    int sceneNumber,
    Instant timestamp
) implements Serializable {
}
