package com.deepansh.orchestrator.branch;

import com.deepansh.orchestrator.model.ReasoningStep;
import com.deepansh.orchestrator.model.WorkflowResult;
import com.deepansh.orchestrator.model.WorkflowStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BranchResultAggregatorTest {

    private final Map<String, WorkflowResult> results = new LinkedHashMap<>();

    @BeforeEach
    void setUp() {
        results.put("a", WorkflowResult.builder()
                .category("a")
                .status(WorkflowStatus.COMPLETED)
                .response("  answer A  ")
                .reasoning(List.of(new ReasoningStep.Action("look", "search_documents", Map.of("query", "x")),
                        new ReasoningStep.Final("", "answer A")))
                .sources(List.of("doc-1"))
                .elapsed(Duration.ofMillis(120))
                .build());
        results.put("b", WorkflowResult.builder()
                .category("b").status(WorkflowStatus.FAILED).error("boom").build());
        results.put("c", WorkflowResult.builder()
                .category("c").status(WorkflowStatus.TIMEOUT).build());
    }

    @Test
    void combinedResponse_tagsEveryBranchInOrder() {
        assertThat(BranchResultAggregator.combinedResponse(results)).isEqualTo(
                "[a] answer A\n\n[b] failed: boom\n\n[c] timeout: no result before the deadline");
    }

    @Test
    void combinedResponse_blankCompletedResponse_isMarked() {
        Map<String, WorkflowResult> single = Map.of("d", WorkflowResult.builder()
                .category("d").status(WorkflowStatus.COMPLETED).response(" ").build());

        assertThat(BranchResultAggregator.combinedResponse(single)).isEqualTo("[d] (no response)");
    }

    @Test
    void taggedReasoning_prefixesEveryRenderedLine() {
        assertThat(BranchResultAggregator.taggedReasoning(results)).containsExactly(
                "[a] Thought: look",
                "[a] Action: search_documents",
                "[a] Action Input: {query=x}",
                "[a] Answer: answer A");
    }

    @Test
    void taggedSources_prefixesCategory() {
        assertThat(BranchResultAggregator.taggedSources(results)).containsExactly("[a] doc-1");
    }

    @Test
    void countByStatus_includesEveryStatus() {
        Map<WorkflowStatus, Integer> counts = BranchResultAggregator.countByStatus(results);

        assertThat(counts).containsEntry(WorkflowStatus.COMPLETED, 1)
                .containsEntry(WorkflowStatus.FAILED, 1)
                .containsEntry(WorkflowStatus.TIMEOUT, 1)
                .containsEntry(WorkflowStatus.CANCELLED, 0);
    }

    @Test
    @SuppressWarnings("unchecked")
    void summary_reportsCountsAndDetails() {
        Map<String, Object> summary = BranchResultAggregator.summary(results);

        Map<String, Object> counts = (Map<String, Object>) summary.get("summary");
        assertThat(counts).containsEntry("categories", List.of("a", "b", "c"))
                .containsEntry("completed", 1)
                .containsEntry("failed", 1)
                .containsEntry("timeout", 1)
                .containsEntry("cancelled", 0);

        List<Map<String, Object>> details = (List<Map<String, Object>>) summary.get("details");
        assertThat(details).hasSize(3);
        assertThat(details.get(0)).containsEntry("elapsed_ms", 120L).containsEntry("sources", 1);
        assertThat(details.get(1)).containsEntry("error", "boom");
        assertThat(details.get(2)).doesNotContainKey("error");
    }
}
