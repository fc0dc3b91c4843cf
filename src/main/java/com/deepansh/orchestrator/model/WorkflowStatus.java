package com.deepansh.orchestrator.model;

import java.util.Locale;

public enum WorkflowStatus {
    COMPLETED, FAILED, TIMEOUT, CANCELLED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
