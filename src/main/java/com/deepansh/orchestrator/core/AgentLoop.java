package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.branch.BranchResultAggregator;
import com.deepansh.orchestrator.branch.CategoryRegistry;
import com.deepansh.orchestrator.branch.ParallelBranchManager;
import com.deepansh.orchestrator.exception.AgentConfigurationException;
import com.deepansh.orchestrator.exception.WorkflowCancelledException;
import com.deepansh.orchestrator.memory.ShortTermMemory;
import com.deepansh.orchestrator.model.AgentRequest;
import com.deepansh.orchestrator.model.AgentResponse;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ReasoningStep;
import com.deepansh.orchestrator.model.WorkflowResult;
import com.deepansh.orchestrator.observability.NoOpWorkflowObserver;
import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.observability.TraceService;
import com.deepansh.orchestrator.observability.WorkflowObserver;
import com.deepansh.orchestrator.run.RunHandle;
import com.deepansh.orchestrator.run.RunRegistry;
import com.deepansh.orchestrator.run.RunStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Top-level run boundary.
 *
 * Per-run flow:
 * 1. Parse the request text into query, metadata and attachments
 * 2. Load short-term memory (Redis)
 * 3. Build a per-run category registry, branch manager and root engine
 * 4. Drive the workflow to Stop (single category or fan-out)
 * 5. Persist conversation to Redis
 * 6. Release branch resources; async: persist trace
 *
 * Every run is registered in the {@link RunRegistry} so it can be queried
 * and cancelled while in flight. A cancelled run stops before its next
 * workflow step and returns a short cancellation response.
 *
 * Always returns a structured response. Only configuration errors escape.
 */
@Service
@Slf4j
public class AgentLoop {

    static final String ROOT_POOL = "_session";

    private final WorkflowEngineFactory engineFactory;
    private final ShortTermMemory shortTermMemory;
    private final TraceService traceService;
    private final InputParser inputParser;
    private final RunRegistry runRegistry;

    public AgentLoop(WorkflowEngineFactory engineFactory,
                     ShortTermMemory shortTermMemory,
                     TraceService traceService,
                     ObjectMapper objectMapper,
                     RunRegistry runRegistry) {
        this.engineFactory = engineFactory;
        this.shortTermMemory = shortTermMemory;
        this.traceService = traceService;
        this.inputParser = new InputParser(objectMapper);
        this.runRegistry = runRegistry;
    }

    public AgentResponse run(AgentRequest request) {
        return execute(runRegistry.create(request), request, NoOpWorkflowObserver.INSTANCE);
    }

    /** Same as {@link #run} with live progress delivered to the observer. */
    public AgentResponse stream(AgentRequest request, WorkflowObserver observer) {
        return execute(runRegistry.create(request), request, observer);
    }

    /** Streams a run the caller registered beforehand, so it could be cancelled before starting. */
    public AgentResponse stream(RunHandle handle, AgentRequest request, WorkflowObserver observer) {
        return execute(handle, request, observer);
    }

    private AgentResponse execute(RunHandle handle, AgentRequest request, WorkflowObserver observer) {
        String sessionId = resolveSessionId(request.getSessionId());
        String userId = request.getUserId() != null ? request.getUserId() : "default";
        String runId = handle.getRunId();
        MDC.put("runId", runId);

        log.info("Run started [sessionId={}, userId={}, input='{}']",
                sessionId, userId, abbreviate(request.getInput()));

        RunContext runCtx = new RunContext(runId);
        CategoryRegistry registry = engineFactory.newCategoryRegistry();
        ParallelBranchManager branchManager = engineFactory.newBranchManager(registry, observer, runCtx);
        handle.start(runCtx, branchManager);
        observer.onWorkflowEvent("run_started", "Run accepted", Map.of("run_id", runId, "session_id", sessionId));
        AgentResponse response = null;
        Throwable error = null;

        try {
            ParsedInput parsed = inputParser.parse(request.getInput());
            if (parsed.query().isBlank()) {
                response = errorResponse(sessionId, "The request contains no input text.");
                handle.fail("empty input");
                return response;
            }

            Map<String, Object> metadata = new LinkedHashMap<>(parsed.metadata());
            if (request.getMetadata() != null) metadata.putAll(request.getMetadata());
            if (!parsed.attachments().isEmpty()) metadata.put("attachments", parsed.attachments());

            List<Message> memory = shortTermMemory.load(sessionId);
            SessionContext ctx = new SessionContext(runId, sessionId, parsed.query(), memory, metadata);

            WorkflowEngine engine = engineFactory.engine(registry.poolFor(ROOT_POOL), observer, runCtx, branchManager);
            WorkflowOutcome outcome = engine.run(ctx, parsed.query());
            if (runCtx.isCancelled()) {
                // cancelled while branches were settling
                throw new WorkflowCancelledException(ctx.getCategory());
            }

            response = buildResponse(ctx, outcome);
            shortTermMemory.save(sessionId, ctx.getMemory());
            handle.complete();

        } catch (AgentConfigurationException e) {
            log.error("Run aborted by configuration error [sessionId={}]: {}", sessionId, e.getMessage());
            error = e;
            handle.fail(e.getMessage());
            throw e;
        } catch (WorkflowCancelledException e) {
            handle.cancel("Workflow interrupted");
            log.warn("Run stopped [sessionId={}, status={}, reason={}]", sessionId, handle.getStatus(), handle.getError());
            error = e;
            response = stoppedResponse(sessionId, handle);
            observer.onWorkflowEvent("run_cancelled", response.getResponse(), Map.of("run_id", runId));
        } catch (RuntimeException e) {
            log.error("Run failed [sessionId={}]", sessionId, e);
            error = e;
            handle.fail(e.getMessage());
            response = errorResponse(sessionId, "An error occurred: " + e.getMessage());
        } finally {
            if (response != null) response.setRunId(runId);
            branchManager.clear();
            // trace is persisted on error too
            traceService.persistTrace(sessionId, userId, request.getInput(),
                    response != null ? response : errorResponse(sessionId, "Error"), runCtx, error);
            MDC.remove("runId");
        }

        log.info("Run complete [sessionId={}, iterations={}, branches={}, latency={}ms]",
                sessionId, response.getIterationsUsed(), response.getBranches().size(), runCtx.elapsedMs());
        return response;
    }

    static AgentResponse buildResponse(SessionContext ctx, WorkflowOutcome outcome) {
        Map<String, WorkflowResult> branches = ctx.getBranchResults();
        List<String> reasoning = new ArrayList<>();
        if (outcome.isFanOut()) {
            reasoning.addAll(BranchResultAggregator.taggedReasoning(branches));
        } else {
            ctx.getReasoning().stream().map(ReasoningStep::render).forEach(reasoning::add);
        }

        Map<String, AgentResponse.BranchSummary> summaries = new LinkedHashMap<>();
        branches.forEach((category, result) -> summaries.put(category, new AgentResponse.BranchSummary(
                result.getStatus().label(),
                result.getResponse(),
                result.getElapsed() != null ? result.getElapsed().toMillis() : 0,
                result.getError())));

        return AgentResponse.builder()
                .sessionId(ctx.getSessionId())
                .response(outcome.response())
                .quickResponse(outcome.isQuickResponse())
                .maxIterationsReached(outcome.isMaxIterationsReached())
                .iterationsUsed(outcome.iterations())
                .categories(new ArrayList<>(ctx.getCategories()))
                .reasoning(reasoning)
                .sources(new ArrayList<>(ctx.getSources()))
                .branches(summaries)
                .build();
    }

    private String resolveSessionId(String provided) {
        return (provided != null && !provided.isBlank()) ? provided : UUID.randomUUID().toString();
    }

    private static AgentResponse stoppedResponse(String sessionId, RunHandle handle) {
        String reason = handle.getError() != null ? handle.getError() : "cancelled";
        String message = handle.getStatus() == RunStatus.FAILED
                ? "The run was stopped: " + reason + "."
                : "The run was cancelled: " + reason + ".";
        return errorResponse(sessionId, message);
    }

    private static AgentResponse errorResponse(String sessionId, String message) {
        return AgentResponse.builder()
                .sessionId(sessionId)
                .response(message)
                .iterationsUsed(0)
                .build();
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 120 ? s : s.substring(0, 120) + "...";
    }
}
