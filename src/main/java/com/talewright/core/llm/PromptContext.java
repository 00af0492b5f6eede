package com.talewright.core.llm;

import com.talewright.core.model.ModelConfig;
import com.talewright.core.model.Phase;

/**
 * Everything an agent call needs besides the agent's role.
 *
 * @param model       model selection of the run
 * @param phase       phase making the call
 * @param sceneNumber scene the call is about, 0 outside drafting
 * @param task        what the agent must do now
 * @param context     assembled context (earlier artifacts, constraints, grounding)
 * @param maxTokens   requested output budget before any learned provider limit is applied
 * @param format      expected reply shape
 */
public record PromptContext(
    ModelConfig model,
    Phase phase,
    int sceneNumber,
    String task,
    String context,
    int maxTokens,
    OutputFormat format
) {

    public PromptContext withFormat(OutputFormat format) {
        return new PromptContext(model, phase, sceneNumber, task, context, maxTokens, format);
    }

    public String userPrompt() {
        if (context == null || context.isBlank()) {
            return task;
        }
        return context + "\n\n---\n\n" + task;
    }
}
