package com.stratum.core.llm;

/**
 * Thrown when the LLM's response cannot be mapped onto the requested type.
 */
public class LlmParseException extends RuntimeException {

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
