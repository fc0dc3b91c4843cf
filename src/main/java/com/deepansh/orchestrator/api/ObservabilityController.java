package com.deepansh.orchestrator.api;

import com.deepansh.orchestrator.observability.AgentRunTrace;
import com.deepansh.orchestrator.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for run traces and analytics.
 *
 * GET /api/v1/traces/{userId}              all run traces for a user
 * GET /api/v1/traces/session/{sessionId}   traces for a specific session
 * GET /api/v1/traces/{userId}/summary      aggregated stats per status and category
 * GET /api/v1/traces/run/{runId}           one run
 * GET /api/v1/traces/category/{category}   runs that used a category
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/{userId}")
    public ResponseEntity<List<AgentRunTrace>> getTraces(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getTracesForUser(userId));
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<AgentRunTrace>> getSessionTraces(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.getTracesForSession(sessionId));
    }

    @GetMapping("/run/{runId}")
    public ResponseEntity<AgentRunTrace> getRun(@PathVariable String runId) {
        return traceService.getTrace(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/category/{category}")
    public ResponseEntity<List<AgentRunTrace>> getCategoryTraces(@PathVariable String category) {
        return ResponseEntity.ok(traceService.getTracesForCategory(category));
    }

    @GetMapping("/{userId}/summary")
    public ResponseEntity<Map<String, Object>> getSummary(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getAnalytics(userId));
    }
}
