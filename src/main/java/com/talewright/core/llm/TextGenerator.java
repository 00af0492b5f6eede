package com.talewright.core.llm;

/**
 * Text-generation backend: one prompt in, one completion out.
 * <p>
 * Implementations report provider failures as runtime exceptions whose message carries the
 * provider's error text; {@link ProviderErrors} classifies them.
 */
@FunctionalInterface
public interface TextGenerator {

    String complete(CompletionRequest request);
}
