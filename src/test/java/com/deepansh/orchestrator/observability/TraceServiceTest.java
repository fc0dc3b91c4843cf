package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.exception.WorkflowCancelledException;
import com.deepansh.orchestrator.model.AgentResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TraceServiceTest {

    @Mock
    private AgentRunTraceRepository repository;

    private TraceService traceService;

    @BeforeEach
    void setUp() {
        traceService = new TraceService(repository, new ObjectMapper());
    }

    @Test
    void persistTrace_recordsBranchStatusesAndToolCalls() {
        Map<String, AgentResponse.BranchSummary> branches = new LinkedHashMap<>();
        branches.put("research-general", new AgentResponse.BranchSummary("completed", "ok", 10, null));
        branches.put("technical-troubleshooting", new AgentResponse.BranchSummary("timeout", null, 50, null));
        AgentResponse response = AgentResponse.builder()
                .response("combined")
                .categories(List.of("research-general", "technical-troubleshooting"))
                .branches(branches)
                .build();
        RunContext runCtx = new RunContext("run-1");
        runCtx.recordToolCall("search_documents", Map.of("query", "pump"), 12, "[]", "research-general");
        runCtx.recordModelCall();

        traceService.persistTrace("s-1", "u-1", "pump fault", response, runCtx, null);

        ArgumentCaptor<AgentRunTrace> captor = ArgumentCaptor.forClass(AgentRunTrace.class);
        verify(repository).save(captor.capture());
        AgentRunTrace trace = captor.getValue();
        assertThat(trace.getRunId()).isEqualTo("run-1");
        assertThat(trace.getStatus()).isEqualTo(AgentRunTrace.Status.PARTIAL);
        assertThat(trace.getBranchStatuses()).containsExactly(
                Map.entry("research-general", "completed"),
                Map.entry("technical-troubleshooting", "timeout"));
        assertThat(trace.getModelCalls()).isEqualTo(1);
        assertThat(trace.getToolCallsJson()).contains("\"toolName\":\"search_documents\"");
    }

    @Test
    void persistTrace_repositoryFailure_isSwallowed() {
        when(repository.save(any())).thenThrow(new IllegalStateException("mongo down"));

        traceService.persistTrace("s-1", "u-1", "q", AgentResponse.builder().build(), new RunContext("run-2"), null);

        verify(repository).save(any());
    }

    @Test
    void getAnalytics_combinesAggregations() {
        when(repository.avgLatencyForUser("u-1")).thenReturn(1234.6);
        when(repository.countRecentByUser(eq("u-1"), any())).thenReturn(3L);
        when(repository.statusBreakdownForUser("u-1")).thenReturn(List.of(
                new AgentRunTraceRepository.GroupCount("SUCCESS", 2),
                new AgentRunTraceRepository.GroupCount("PARTIAL", 1)));
        when(repository.categoryBreakdownForUser(anyString())).thenReturn(List.of(
                new AgentRunTraceRepository.GroupCount("research-general", 3)));

        Map<String, Object> analytics = traceService.getAnalytics("u-1");

        assertThat(analytics).containsEntry("avgLatencyMs", 1235L)
                .containsEntry("runsLast24h", 3L)
                .containsEntry("statusBreakdown", Map.of("SUCCESS", 2L, "PARTIAL", 1L))
                .containsEntry("categoryBreakdown", Map.of("research-general", 3L));
    }

    @Test
    void statusOf_errorWinsOverEverything() {
        AgentResponse response = AgentResponse.builder().quickResponse(true).build();

        assertThat(TraceService.statusOf(response, new IllegalStateException("x")))
                .isEqualTo(AgentRunTrace.Status.ERROR);
    }

    @Test
    void statusOf_cancelledRun() {
        assertThat(TraceService.statusOf(AgentResponse.builder().build(), new WorkflowCancelledException(null)))
                .isEqualTo(AgentRunTrace.Status.CANCELLED);
    }

    @Test
    void statusOf_quickAndMaxIterations() {
        assertThat(TraceService.statusOf(AgentResponse.builder().quickResponse(true).build(), null))
                .isEqualTo(AgentRunTrace.Status.QUICK_RESPONSE);
        assertThat(TraceService.statusOf(AgentResponse.builder().maxIterationsReached(true).build(), null))
                .isEqualTo(AgentRunTrace.Status.MAX_ITERATIONS);
    }

    @Test
    void statusOf_anyUnfinishedBranch_isPartial() {
        Map<String, AgentResponse.BranchSummary> branches = new LinkedHashMap<>();
        branches.put("a", new AgentResponse.BranchSummary("completed", "ok", 10, null));
        branches.put("b", new AgentResponse.BranchSummary("timeout", null, 3600000, null));

        AgentResponse response = AgentResponse.builder().branches(branches).build();

        assertThat(TraceService.statusOf(response, null)).isEqualTo(AgentRunTrace.Status.PARTIAL);
    }

    @Test
    void statusOf_allBranchesCompleted_isSuccess() {
        Map<String, AgentResponse.BranchSummary> branches = new LinkedHashMap<>();
        branches.put("a", new AgentResponse.BranchSummary("completed", "ok", 10, null));

        assertThat(TraceService.statusOf(AgentResponse.builder().branches(branches).build(), null))
                .isEqualTo(AgentRunTrace.Status.SUCCESS);
        assertThat(TraceService.statusOf(AgentResponse.builder().build(), null))
                .isEqualTo(AgentRunTrace.Status.SUCCESS);
    }
}
