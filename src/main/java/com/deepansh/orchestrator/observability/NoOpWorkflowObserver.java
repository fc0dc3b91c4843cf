package com.deepansh.orchestrator.observability;

/** Used for batch runs and tests where nobody is listening. */
public final class NoOpWorkflowObserver implements WorkflowObserver {

    public static final NoOpWorkflowObserver INSTANCE = new NoOpWorkflowObserver();

    private NoOpWorkflowObserver() {
    }
}
