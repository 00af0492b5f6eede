package com.talewright.core.llm;

/**
 * A single completion request.
 *
 * @param systemPrompt agent role instructions
 * @param userPrompt   task and context
 * @param model        model identifier
 * @param maxTokens    requested output-token budget
 * @param temperature  sampling temperature
 */
public record CompletionRequest(
    String systemPrompt,
    String userPrompt,
    String model,
    int maxTokens,
    double temperature
) {
}
