package com.juno.core.llm;

/**
 * Thrown when the model returns no content for a structured call.
 */
public class LlmEmptyResponseException extends RuntimeException {
    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
