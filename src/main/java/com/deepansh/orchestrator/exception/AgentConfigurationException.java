package com.deepansh.orchestrator.exception;

/**
 * A required external collaborator is missing or misconfigured.
 * The only failure allowed to escape a run.
 */
public class AgentConfigurationException extends AgentException {

    public AgentConfigurationException(String message) {
        super(message);
    }
}
