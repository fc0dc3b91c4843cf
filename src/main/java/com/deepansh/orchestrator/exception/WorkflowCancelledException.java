package com.deepansh.orchestrator.exception;

public class WorkflowCancelledException extends RuntimeException {

    public WorkflowCancelledException(String category) {
        super("Workflow cancelled [category=" + category + "]");
    }
}
