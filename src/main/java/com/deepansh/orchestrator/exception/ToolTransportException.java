package com.deepansh.orchestrator.exception;

/**
 * Transport-level tool failure (connection lost, session invalidated, bad frame).
 * Retried by the tool dispatcher.
 */
public class ToolTransportException extends RuntimeException {

    private final boolean notConnected;

    public ToolTransportException(String message) {
        this(message, null, false);
    }

    public ToolTransportException(String message, Throwable cause) {
        this(message, cause, false);
    }

    protected ToolTransportException(String message, Throwable cause, boolean notConnected) {
        super(message, cause);
        this.notConnected = notConnected;
    }

    /** The transport has no live session; the caller should reconnect before retrying. */
    public static ToolTransportException notConnected(String message, Throwable cause) {
        return new ToolTransportException(message, cause, true);
    }

    public boolean isNotConnected() {
        return notConnected;
    }
}
