package com.deepansh.orchestrator.exception;

/**
 * Model output did not match the expected reasoning-step format.
 * Recorded as an observation; the loop continues.
 */
public class ReasoningParseException extends RuntimeException {

    public ReasoningParseException(String message) {
        super(message);
    }

    public ReasoningParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
