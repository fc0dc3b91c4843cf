package com.deepansh.orchestrator.core;

/**
 * What a finished engine run produced. Trace, sources and branch results
 * stay on the {@link SessionContext}.
 */
public record WorkflowOutcome(WorkflowEvent.StopReason reason, String response, int iterations) {

    public boolean isQuickResponse() {
        return reason == WorkflowEvent.StopReason.QUICK_RESPONSE;
    }

    public boolean isMaxIterationsReached() {
        return reason == WorkflowEvent.StopReason.MAX_ITERATIONS;
    }

    public boolean isFanOut() {
        return reason == WorkflowEvent.StopReason.FAN_OUT;
    }
}
