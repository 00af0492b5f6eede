package com.talewright.core.llm;

/**
 * Thrown when agent output cannot be parsed as the structured JSON the phase expects,
 * even after a corrective re-prompt.
 */
public class LlmParseException extends RuntimeException {
    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
