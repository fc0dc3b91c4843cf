package com.deepansh.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one category branch. Built once when the branch settles.
 */
@Value
@Builder
public class WorkflowResult {

    String category;
    WorkflowStatus status;

    @Builder.Default
    List<ReasoningStep> reasoning = List.of();

    @Builder.Default
    List<String> sources = List.of();

    String response;
    Duration elapsed;
    String error;

    public boolean isCompleted() {
        return status == WorkflowStatus.COMPLETED;
    }
}
