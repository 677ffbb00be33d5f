package com.deskpilot.orchestrator.llm;

/**
 * Thrown when the local model server cannot be reached or answers with a
 * non-2xx status.
 */
public class LlmUnavailableException extends RuntimeException {

    public LlmUnavailableException(String message) {
        super(message);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
