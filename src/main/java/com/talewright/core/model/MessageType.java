package com.talewright.core.model;

/**
 * Kind of an {@link AgentMessage} in the audit trail.
 */
public enum MessageType {
    ARTIFACT,
    QUESTION,
    RESPONSE,
    OBJECTION,
    APPROVAL,
    REVISION_REQUEST
}
