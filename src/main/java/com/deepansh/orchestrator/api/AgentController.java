package com.deepansh.orchestrator.api;

import com.deepansh.orchestrator.core.AgentLoop;
import com.deepansh.orchestrator.exception.AgentConfigurationException;
import com.deepansh.orchestrator.model.AgentRequest;
import com.deepansh.orchestrator.model.AgentResponse;
import com.deepansh.orchestrator.observability.SseWorkflowObserver;
import com.deepansh.orchestrator.resilience.IdempotencyService;
import com.deepansh.orchestrator.run.RunHandle;
import com.deepansh.orchestrator.run.RunRegistry;
import com.deepansh.orchestrator.run.RunSummary;
import com.deepansh.orchestrator.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Primary orchestration endpoints.
 *
 * POST /api/v1/agent/run
 *   Optional header: Idempotency-Key: <uuid>
 *   If provided, duplicate requests within 24h return the cached response.
 *
 * POST /api/v1/agent/stream
 *   Server-Sent Events: step, streaming, tool and filter events, then one
 *   terminal "result" (or "error") event carrying the response.
 *   Closing the stream cancels the run.
 *
 * GET    /api/v1/agent/runs/{runId}   status of one run
 * DELETE /api/v1/agent/runs/{runId}   cancel a run that has not finished
 * GET    /api/v1/agent/runs?userId=&limit=10
 *
 * GET /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@Slf4j
public class AgentController {

    private static final long STREAM_TIMEOUT_MS = 3_600_000L;

    private final AgentLoop agentLoop;
    private final RunRegistry runRegistry;
    private final IdempotencyService idempotencyService;
    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final AsyncTaskExecutor runExecutor;
    private final Executor observerExecutor;

    public AgentController(AgentLoop agentLoop,
                           RunRegistry runRegistry,
                           IdempotencyService idempotencyService,
                           ToolRegistry toolRegistry,
                           ObjectMapper objectMapper,
                           @Qualifier("runExecutor") AsyncTaskExecutor runExecutor,
                           @Qualifier("observerExecutor") Executor observerExecutor) {
        this.agentLoop = agentLoop;
        this.runRegistry = runRegistry;
        this.idempotencyService = idempotencyService;
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.runExecutor = runExecutor;
        this.observerExecutor = observerExecutor;
    }

    @PostMapping("/run")
    public ResponseEntity<AgentResponse> run(
            @Valid @RequestBody AgentRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Run request [sessionId={}, userId={}, idempotencyKey={}]",
                request.getSessionId(), request.getUserId(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            Optional<AgentResponse> cached = idempotencyService.getCachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                log.info("Returning cached response for idempotency key={}", idempotencyKey);
                return ResponseEntity.ok(cached.get());
            }
            idempotencyService.claimKey(idempotencyKey);
        }

        AgentResponse response;
        try {
            response = agentLoop.run(request);
        } catch (RuntimeException e) {
            // On error, release the key so the client can retry
            if (idempotent) idempotencyService.releaseKey(idempotencyKey);
            throw e;
        }

        if (idempotent) idempotencyService.storeResponse(idempotencyKey, response);
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody AgentRequest request) {
        log.info("Stream request [sessionId={}, userId={}]", request.getSessionId(), request.getUserId());

        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        SseWorkflowObserver observer = new SseWorkflowObserver(emitter, objectMapper, observerExecutor);
        RunHandle handle = runRegistry.create(request);
        observer.onDisconnect(() -> handle.cancel("Client disconnected"));
        handle.onStop(() -> observer.fail("Run " + handle.getStatus().label() + ": " + handle.getError()));
        try {
            Future<?> future = runExecutor.submit(() -> {
                try {
                    observer.complete(agentLoop.stream(handle, request, observer));
                } catch (AgentConfigurationException e) {
                    observer.fail(e.getMessage());
                }
                if (observer.droppedCount() > 0) {
                    log.warn("Slow SSE client: {} event(s) dropped", observer.droppedCount());
                }
            });
            handle.attach(future);
        } catch (RejectedExecutionException e) {
            log.error("Run executor saturated, rejecting stream request");
            handle.fail("Server is busy");
            observer.fail("Server is busy, try again later");
        }
        return emitter;
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunSummary> runStatus(@PathVariable String runId) {
        return runRegistry.get(runId)
                .map(run -> ResponseEntity.ok(run.summary()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/runs/{runId}")
    public ResponseEntity<Map<String, Object>> cancelRun(@PathVariable String runId) {
        Optional<RunHandle> run = runRegistry.get(runId);
        if (run.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        RunHandle handle = run.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId);
        if (!handle.cancel("Cancelled by client")) {
            body.put("status", handle.getStatus().label());
            body.put("error", "Run already finished and cannot be cancelled");
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
        }
        log.info("Run cancelled on request [runId={}]", runId);
        body.put("status", handle.getStatus().label());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/runs")
    public ResponseEntity<Map<String, Object>> listRuns(
            @RequestParam(required = false) String userId,
            @RequestParam(defaultValue = "10") int limit) {
        List<RunHandle> all = runRegistry.list(userId, Integer.MAX_VALUE);
        List<RunSummary> runs = all.stream()
                .limit(Math.max(0, limit))
                .map(RunHandle::summary)
                .collect(Collectors.toList());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runs", runs);
        body.put("total", all.size());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        try {
            body.put("tools", toolRegistry.toolCount());
        } catch (RuntimeException e) {
            log.warn("Tool server unavailable during health check: {}", e.getMessage());
            body.put("tools", "unavailable");
        }
        return ResponseEntity.ok(body);
    }
}
