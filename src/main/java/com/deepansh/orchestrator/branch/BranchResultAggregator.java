package com.deepansh.orchestrator.branch;

import com.deepansh.orchestrator.model.ReasoningStep;
import com.deepansh.orchestrator.model.WorkflowResult;
import com.deepansh.orchestrator.model.WorkflowStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges branch results into category-tagged output.
 *
 * Iterates in the map's order, which is the order categories were
 * supplied. A failed, timed-out or cancelled branch contributes an explicit
 * entry and never hides a sibling's output.
 */
public final class BranchResultAggregator {

    private BranchResultAggregator() {
    }

    public static String combinedResponse(Map<String, WorkflowResult> results) {
        List<String> parts = new ArrayList<>();
        results.forEach((category, result) -> parts.add(responseEntry(category, result)));
        return String.join("\n\n", parts);
    }

    /** Every rendered trace line of every branch, prefixed with the branch's category tag. */
    public static List<String> taggedReasoning(Map<String, WorkflowResult> results) {
        List<String> lines = new ArrayList<>();
        results.forEach((category, result) -> {
            for (ReasoningStep step : result.getReasoning()) {
                for (String line : step.render().split("\n")) {
                    lines.add(tag(category) + line);
                }
            }
        });
        return lines;
    }

    public static List<String> taggedSources(Map<String, WorkflowResult> results) {
        List<String> lines = new ArrayList<>();
        results.forEach((category, result) -> result.getSources().forEach(s -> lines.add(tag(category) + s)));
        return lines;
    }

    public static Map<WorkflowStatus, Integer> countByStatus(Map<String, WorkflowResult> results) {
        Map<WorkflowStatus, Integer> counts = new EnumMap<>(WorkflowStatus.class);
        for (WorkflowStatus status : WorkflowStatus.values()) counts.put(status, 0);
        results.values().forEach(r -> counts.merge(r.getStatus(), 1, Integer::sum));
        return counts;
    }

    /**
     * Summary block: {summary: {categories, completed, failed, timeout, cancelled}, details: [...]}.
     */
    public static Map<String, Object> summary(Map<String, WorkflowResult> results) {
        Map<WorkflowStatus, Integer> counts = countByStatus(results);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("categories", new ArrayList<>(results.keySet()));
        for (WorkflowStatus status : WorkflowStatus.values()) {
            summary.put(status.label(), counts.get(status));
        }

        List<Map<String, Object>> details = new ArrayList<>();
        results.forEach((category, result) -> {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("category", category);
            detail.put("status", result.getStatus().label());
            detail.put("response", result.getResponse());
            detail.put("sources", result.getSources().size());
            detail.put("elapsed_ms", result.getElapsed() == null ? 0 : result.getElapsed().toMillis());
            if (result.getError() != null) detail.put("error", result.getError());
            details.add(detail);
        });

        Map<String, Object> aggregated = new LinkedHashMap<>();
        aggregated.put("summary", summary);
        aggregated.put("details", details);
        return aggregated;
    }

    private static String responseEntry(String category, WorkflowResult result) {
        switch (result.getStatus()) {
            case COMPLETED:
                String response = result.getResponse();
                return tag(category) + (response == null || response.isBlank() ? "(no response)" : response.strip());
            case FAILED:
                return tag(category) + "failed: " + (result.getError() == null ? "unknown error" : result.getError());
            case TIMEOUT:
                return tag(category) + "timeout: no result before the deadline";
            default:
                return tag(category) + "cancelled";
        }
    }

    private static String tag(String category) {
        return "[" + category + "] ";
    }
}
