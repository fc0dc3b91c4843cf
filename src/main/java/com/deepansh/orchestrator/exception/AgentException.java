package com.deepansh.orchestrator.exception;

/**
 * Non-retryable failure raised by the orchestrator.
 *
 * Listed in the resilience4j ignore-exceptions for the llmClient instance,
 * so a 4xx from a provider neither retries nor trips the circuit breaker.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
