package com.deepansh.orchestrator.tool;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Remote tool-execution seam.
 *
 * {@link #callTool} throws {@link com.deepansh.orchestrator.exception.ToolTransportException}
 * (retryable) on connection problems and
 * {@link com.deepansh.orchestrator.exception.ToolTimeoutException} when the
 * call exceeds its timeout.
 */
public interface ToolTransport {

    List<ToolDefinition> listTools();

    String callTool(String name, Map<String, Object> arguments, Duration timeout);

    /** Drops the current session and establishes a new one. */
    void reconnect();
}
