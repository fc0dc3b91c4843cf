package com.deepansh.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {

    private String runId;
    private String sessionId;
    private String response;

    private boolean quickResponse;
    private boolean maxIterationsReached;
    private int iterationsUsed;

    @Builder.Default
    private List<String> categories = new ArrayList<>();

    /** Rendered reasoning trace; category-tagged when branches ran. */
    @Builder.Default
    private List<String> reasoning = new ArrayList<>();

    @Builder.Default
    private List<String> sources = new ArrayList<>();

    /** Per-category branch outcome, in the order categories were recognized. */
    @Builder.Default
    private Map<String, BranchSummary> branches = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BranchSummary {
        private String status;
        private String response;
        private long elapsedMs;
        private String error;
    }
}
