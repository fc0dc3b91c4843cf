package com.deepansh.orchestrator.exception;

import java.time.Duration;

public class ToolTimeoutException extends ToolTransportException {

    public ToolTimeoutException(String toolName, Duration timeout) {
        super("Tool '" + toolName + "' timed out after " + timeout.toSeconds() + "s");
    }
}
