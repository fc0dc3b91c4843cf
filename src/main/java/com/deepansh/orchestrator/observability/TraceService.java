package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.exception.WorkflowCancelledException;
import com.deepansh.orchestrator.model.AgentResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Persists run traces and exposes analytics.
 *
 * Trace persistence is @Async and never blocks the run response.
 * Analytics queries are synchronous (called explicitly by the traces endpoint).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final AgentRunTraceRepository traceRepository;
    private final ObjectMapper objectMapper;

    /**
     * Persist a completed run trace asynchronously.
     * Called at the end of every run from AgentLoop, including failed ones.
     */
    @Async("traceTaskExecutor")
    public void persistTrace(String sessionId, String userId, String userInput,
                             AgentResponse response, RunContext runCtx, Throwable error) {
        try {
            AgentRunTrace.Status status = statusOf(response, error);

            Map<String, String> branchStatuses = new LinkedHashMap<>();
            response.getBranches().forEach((category, branch) -> branchStatuses.put(category, branch.getStatus()));

            AgentRunTrace trace = AgentRunTrace.builder()
                    .runId(runCtx.getRunId())
                    .sessionId(sessionId)
                    .userId(userId)
                    .userInput(truncate(userInput, 4000))
                    .finalAnswer(truncate(response.getResponse(), 8000))
                    .status(status)
                    .iterationsUsed(response.getIterationsUsed())
                    .totalLatencyMs(runCtx.elapsedMs())
                    .modelCalls(runCtx.getModelCalls().get())
                    .categories(List.copyOf(response.getCategories()))
                    .branchStatuses(branchStatuses)
                    .toolCallsJson(serializeToolCalls(runCtx.getToolCallRecords()))
                    .errorMessage(error != null ? truncate(error.getMessage(), 2000) : null)
                    .build();

            traceRepository.save(trace);

            log.info("Trace persisted [session={}, status={}, latency={}ms, modelCalls={}]",
                    sessionId, status, runCtx.elapsedMs(), runCtx.getModelCalls().get());

        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("Failed to persist run trace for session={}", sessionId, e);
        }
    }

    static AgentRunTrace.Status statusOf(AgentResponse response, Throwable error) {
        if (error instanceof WorkflowCancelledException) return AgentRunTrace.Status.CANCELLED;
        if (error != null) return AgentRunTrace.Status.ERROR;
        if (response.isQuickResponse()) return AgentRunTrace.Status.QUICK_RESPONSE;
        if (response.isMaxIterationsReached()) return AgentRunTrace.Status.MAX_ITERATIONS;
        boolean partial = response.getBranches().values().stream()
                .anyMatch(b -> !"completed".equals(b.getStatus()));
        return partial ? AgentRunTrace.Status.PARTIAL : AgentRunTrace.Status.SUCCESS;
    }

    public List<AgentRunTrace> getTracesForUser(String userId) {
        return traceRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public List<AgentRunTrace> getTracesForSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    public Optional<AgentRunTrace> getTrace(String runId) {
        return traceRepository.findByRunId(runId);
    }

    public List<AgentRunTrace> getTracesForCategory(String category) {
        return traceRepository.findByCategoriesContainingOrderByCreatedAtDesc(category);
    }

    /**
     * Summary analytics for a user: average latency, recent volume and status breakdown.
     */
    public Map<String, Object> getAnalytics(String userId) {
        Instant since24h = Instant.now().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatencyForUser(userId);
        long runsLast24h = traceRepository.countRecentByUser(userId, since24h);
        Map<String, Long> statusBreakdown = traceRepository.statusBreakdownForUser(userId).stream()
                .collect(Collectors.toMap(
                        AgentRunTraceRepository.GroupCount::id,
                        AgentRunTraceRepository.GroupCount::count));
        Map<String, Long> categoryBreakdown = traceRepository.categoryBreakdownForUser(userId).stream()
                .collect(Collectors.toMap(
                        AgentRunTraceRepository.GroupCount::id,
                        AgentRunTraceRepository.GroupCount::count));

        return Map.of(
                "userId", userId,
                "avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0,
                "runsLast24h", runsLast24h,
                "statusBreakdown", statusBreakdown,
                "categoryBreakdown", categoryBreakdown
        );
    }

    private String serializeToolCalls(List<RunContext.ToolCallRecord> records) {
        if (records.isEmpty()) return "[]";
        try {
            return objectMapper.writeValueAsString(records.stream()
                    .map(r -> {
                        Map<String, Object> entry = new LinkedHashMap<>();
                        entry.put("toolName", r.toolName());
                        entry.put("category", r.category());
                        entry.put("latencyMs", r.latencyMs());
                        entry.put("resultPreview", truncate(r.result(), 200));
                        return entry;
                    })
                    .toList());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize tool calls: {}", e.getOriginalMessage());
            return "[]";
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
