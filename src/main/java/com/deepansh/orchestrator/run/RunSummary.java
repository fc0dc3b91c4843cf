package com.deepansh.orchestrator.run;

import java.time.Instant;

/** Read-only view of a run, as returned by the run endpoints. */
public record RunSummary(
        String runId,
        String sessionId,
        String userId,
        String status,
        String input,
        String error,
        Instant createdAt,
        Instant updatedAt,
        Instant deadline
) {}
