package com.talewright.core.llm;

/**
 * An agent reply bound to a typed record.
 *
 * @param reply the raw reply, kept for the audit trail and as the stored artifact
 * @param value the reply bound to the requested type
 */
public record StructuredReply<T>(AgentReply reply, T value) {
}
