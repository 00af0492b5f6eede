package com.talewright.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An unvetted fact candidate extracted from generated text, consumed by the Archivist.
 *
 * @param key         semantic constraint key the fact would update
 * @param value       asserted value
 * @param fact        the sentence fragment the fact was read from
 * @param source      agent whose output contained the fact
 * @param sceneNumber scene the text belongs to
 * @param timestamp   extraction time
 */
public record RawFact(
    String key,
    String value,
    String fact,
    AgentRole source,
    int sceneNumber,
    Instant timestamp
) implements Serializable {
}
