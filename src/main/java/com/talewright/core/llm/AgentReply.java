package com.talewright.core.llm;

import com.talewright.core.model.AgentRole;

import java.util.Map;

/**
 * Result of an agent call.
 *
 * @param role     agent that answered
 * @param text     raw reply text (for prose replies, the prose itself)
 * @param json     parsed reply for {@link OutputFormat#JSON} calls, empty otherwise
 * @param attempts provider calls spent, including retries
 */
public record AgentReply(AgentRole role, String text, Map<String, Object> json, int attempts) {
}
