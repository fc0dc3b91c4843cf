package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.branch.BranchResultAggregator;
import com.deepansh.orchestrator.branch.CategoryModelPool;
import com.deepansh.orchestrator.exception.AgentConfigurationException;
import com.deepansh.orchestrator.exception.ReasoningParseException;
import com.deepansh.orchestrator.exception.WorkflowCancelledException;
import com.deepansh.orchestrator.filter.ConcurrentChunkFilter;
import com.deepansh.orchestrator.llm.ModelRole;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ReasoningStep;
import com.deepansh.orchestrator.model.RecognizedEntity;
import com.deepansh.orchestrator.model.ToolCall;
import com.deepansh.orchestrator.model.WorkflowResult;
import com.deepansh.orchestrator.model.WorkflowStatus;
import com.deepansh.orchestrator.observability.NoOpWorkflowObserver;
import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.observability.SafeWorkflowObserver;
import com.deepansh.orchestrator.observability.StreamingContent;
import com.deepansh.orchestrator.observability.WorkflowObserver;
import com.deepansh.orchestrator.plan.PlanStore;
import com.deepansh.orchestrator.stream.ResponseSections;
import com.deepansh.orchestrator.stream.StreamingResponseSplitter;
import com.deepansh.orchestrator.tool.ToolDispatcher;
import com.deepansh.orchestrator.tool.ToolInjection;
import com.deepansh.orchestrator.tool.ToolOutput;
import com.deepansh.orchestrator.tool.ToolRegistry;
import com.deepansh.orchestrator.tool.ToolResultNormalizer;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Step workflow: one instance drives one {@link SessionContext} to Stop.
 *
 * <pre>
 * Start → IntentCheck → Stop(quick answer)
 *                     → EntityExtract → PlanGate → FanOut → Stop
 *                                                → GeneratePlan → PrepareHistory → Reason
 *                                                      Reason → ToolDispatch → PrepareHistory
 *                                                      Reason → PrepareHistory (milestone / parse error)
 *                                                      Reason → Stop (answer / max iterations)
 * </pre>
 *
 * Steps run strictly one after another on the calling thread. Model calls
 * go to this engine's category pool only, so branches never share a client.
 * A context that reached Stop cannot be driven again.
 */
@Slf4j
public class WorkflowEngine {

    static final String PARSE_ERROR_PREFIX = "There was an error in parsing my reasoning: ";
    static final String NO_CHUNKS = "No relevant document chunks were found.";

    private final CategoryModelPool models;
    private final ToolRegistry toolRegistry;
    private final ToolDispatcher toolDispatcher;
    private final ToolResultNormalizer resultNormalizer;
    private final ConcurrentChunkFilter chunkFilter;
    private final PlanStore planStore;
    private final StructuredOutputParser outputParser;
    private final ReasoningStepParser stepParser;
    private final EntityMetadataMerger metadataMerger;
    private final WorkflowTemplates templates;
    private final PromptFormatter prompts;
    private final WorkflowObserver observer;
    private final BranchLauncher branchLauncher;
    private final RunContext runContext;
    private final Collection<String> knownCategories;
    private final int maxIterations;

    @Builder
    public WorkflowEngine(CategoryModelPool models,
                          ToolRegistry toolRegistry,
                          ToolDispatcher toolDispatcher,
                          ToolResultNormalizer resultNormalizer,
                          ConcurrentChunkFilter chunkFilter,
                          PlanStore planStore,
                          StructuredOutputParser outputParser,
                          ReasoningStepParser stepParser,
                          EntityMetadataMerger metadataMerger,
                          WorkflowTemplates templates,
                          PromptFormatter prompts,
                          WorkflowObserver observer,
                          BranchLauncher branchLauncher,
                          RunContext runContext,
                          Collection<String> knownCategories,
                          int maxIterations) {
        this.models = models;
        this.toolRegistry = toolRegistry;
        this.toolDispatcher = toolDispatcher;
        this.resultNormalizer = resultNormalizer;
        this.chunkFilter = chunkFilter;
        this.planStore = planStore;
        this.outputParser = outputParser;
        this.stepParser = stepParser;
        this.metadataMerger = metadataMerger != null ? metadataMerger : new EntityMetadataMerger();
        this.templates = templates;
        this.prompts = prompts != null ? prompts : new PromptFormatter();
        this.observer = SafeWorkflowObserver.wrap(observer != null ? observer : NoOpWorkflowObserver.INSTANCE);
        this.branchLauncher = branchLauncher;
        this.runContext = runContext;
        this.knownCategories = knownCategories != null ? List.copyOf(knownCategories) : List.of();
        this.maxIterations = maxIterations > 0 ? maxIterations : 10;
    }

    /** Full run from the raw user query. */
    public WorkflowOutcome run(SessionContext ctx, String query) {
        return drive(ctx, new WorkflowEvent.Start(query));
    }

    /**
     * Branch run: intent and entities were settled by the parent, so the
     * branch starts at plan generation for its own category.
     */
    public WorkflowOutcome runBranch(SessionContext ctx) {
        if (ctx.getTemplate().isBlank() && ctx.getCategory() != null) {
            ctx.setTemplate(templates.templateFor(ctx.getCategory()));
        }
        return drive(ctx, new WorkflowEvent.GeneratePlan(ctx.getUserInput()));
    }

    private WorkflowOutcome drive(SessionContext ctx, WorkflowEvent first) {
        if (ctx.isStopped()) {
            throw new IllegalStateException("Workflow already stopped [run=" + ctx.getRunId() + "]");
        }

        WorkflowEvent event = first;
        while (!(event instanceof WorkflowEvent.Stop)) {
            if (Thread.currentThread().isInterrupted() || (runContext != null && runContext.isCancelled())) {
                throw new WorkflowCancelledException(ctx.getCategory());
            }
            String step = event.step();
            observer.onStepStart(step, stepData(ctx));
            event = dispatch(ctx, event);
            observer.onStepComplete(step, stepData(ctx));
        }

        WorkflowEvent.Stop stop = (WorkflowEvent.Stop) event;
        ctx.markStopped();
        log.info("Workflow stopped [reason={}, iterations={}, category={}]",
                stop.reason(), ctx.getIterations(), ctx.getCategory());
        return new WorkflowOutcome(stop.reason(), stop.response(), ctx.getIterations());
    }

    private WorkflowEvent dispatch(SessionContext ctx, WorkflowEvent event) {
        if (event instanceof WorkflowEvent.Start start) return start(ctx, start);
        if (event instanceof WorkflowEvent.IntentCheck intent) return intentCheck(ctx, intent);
        if (event instanceof WorkflowEvent.EntityExtract entities) return entityExtract(ctx, entities);
        if (event instanceof WorkflowEvent.PlanGate gate) return planGate(ctx, gate);
        if (event instanceof WorkflowEvent.GeneratePlan plan) return generatePlan(ctx, plan);
        if (event instanceof WorkflowEvent.PrepareHistory) return prepareHistory(ctx);
        if (event instanceof WorkflowEvent.ReasonInput input) return reason(ctx, input);
        if (event instanceof WorkflowEvent.ToolDispatch call) return toolDispatch(ctx, call);
        if (event instanceof WorkflowEvent.FanOut fanOut) return fanOut(ctx, fanOut);
        throw new IllegalStateException("No step handles " + event.getClass().getSimpleName());
    }

    // ─── Steps ────────────────────────────────────────────────────────────────

    private WorkflowEvent start(SessionContext ctx, WorkflowEvent.Start event) {
        ctx.setUserInput(event.query());
        ctx.addMessage(Message.user(event.query()));
        return new WorkflowEvent.IntentCheck(event.query());
    }

    private WorkflowEvent intentCheck(SessionContext ctx, WorkflowEvent.IntentCheck event) {
        IntentVerdict verdict;
        try {
            String output = streamed(ModelRole.INTENT, ctx, "intent_recognition",
                    List.of(Message.user(prompts.intent(event.query(), knownCategories))));
            verdict = outputParser.parseIntent(output);
        } catch (AgentConfigurationException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Intent recognition failed, continuing without categories: {}", e.getMessage());
            verdict = IntentVerdict.fallback();
        }

        if (verdict.shortCircuits()) {
            ctx.addMessage(Message.assistant(verdict.standardAnswer()));
            observer.onWorkflowEvent("quick_response_triggered",
                    "Quick response: " + abbreviate(verdict.standardAnswer(), 50),
                    eventData(ctx, "standard_answer", verdict.standardAnswer()));
            return new WorkflowEvent.Stop(WorkflowEvent.StopReason.QUICK_RESPONSE, verdict.standardAnswer());
        }

        ctx.setCategories(verdict.categories());
        log.info("Intent recognized [categories={}]", verdict.categories());
        observer.onWorkflowEvent("intent_recognition_complete",
                "Workflow categories: " + verdict.categories(),
                eventData(ctx, "workflow_categories", verdict.categories()));
        return new WorkflowEvent.EntityExtract(event.query());
    }

    private WorkflowEvent entityExtract(SessionContext ctx, WorkflowEvent.EntityExtract event) {
        try {
            String output = streamed(ModelRole.ENTITY, ctx, "entity_recognition",
                    List.of(Message.user(prompts.entities(event.query()))));
            List<RecognizedEntity> entities = outputParser.parseEntities(output);

            List<String> categories = ctx.getCategories();
            if (categories.isEmpty()) {
                ctx.setTemplate("");
            } else {
                ctx.setCategory(categories.get(0));
                ctx.setTemplate(templates.templateFor(categories.get(0)));
            }
            ctx.setEntities(entities);
            ctx.replaceMetadata(metadataMerger.merge(ctx.getMetadata(), entities));

        } catch (AgentConfigurationException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Entity recognition failed, using the default template: {}", e.getMessage());
            ctx.setEntities(List.of());
            ctx.setTemplate(templates.defaultTemplate());
        }

        observer.onWorkflowEvent("entity_recognition_complete",
                "Recognized " + ctx.getEntities().size() + " entities",
                eventData(ctx, "entity_count", ctx.getEntities().size()));
        return new WorkflowEvent.PlanGate(ctx.getCategories());
    }

    private WorkflowEvent planGate(SessionContext ctx, WorkflowEvent.PlanGate event) {
        if (event.categories().size() > 1) {
            if (branchLauncher != null) {
                return new WorkflowEvent.FanOut(event.categories());
            }
            log.warn("No branch launcher configured, running only category [{}]", event.categories().get(0));
        }
        return new WorkflowEvent.GeneratePlan(ctx.getUserInput());
    }

    private WorkflowEvent generatePlan(SessionContext ctx, WorkflowEvent.GeneratePlan event) {
        if (!ctx.getPlan().isBlank()) {
            log.debug("Plan already present, skipping generation");
            return new WorkflowEvent.PrepareHistory();
        }

        String category = ctx.getCategory();
        String example = category != null ? planStore.getPlan(event.query(), category).orElse("") : "";
        String prompt = prompts.planning(event.query(), ctx.getTemplate(), example,
                toolCatalogue(category), ctx.getMetadata());

        String plan = ResponseSections.answerBody(
                streamed(ModelRole.PLANNING, ctx, "planning", List.of(Message.user(prompt)))).strip();
        ctx.setPlan(plan);
        if (category != null && !plan.isBlank()) {
            planStore.putPlan(event.query(), plan, category);
        }

        log.info("Plan generated [category={}, chars={}, example={}]", category, plan.length(), !example.isEmpty());
        observer.onWorkflowEvent("plan_generation_complete", "Plan generated", eventData(ctx, "plan", plan));
        return new WorkflowEvent.PrepareHistory();
    }

    private WorkflowEvent prepareHistory(SessionContext ctx) {
        if (!ctx.getPlan().isBlank() && !ctx.getReasoning().isEmpty()) {
            refreshPlan(ctx);
        }

        List<Message> history = new ArrayList<>();
        history.add(Message.system(prompts.reactSystem(
                toolCatalogue(ctx.getCategory()), ctx.getPlan(), ctx.getMetadata())));
        ctx.getMemory().forEach(m -> history.add(m.copy()));
        for (ReasoningStep step : ctx.getReasoning()) {
            history.add(step.accept(TRACE_TO_MESSAGE));
        }
        return new WorkflowEvent.ReasonInput(history);
    }

    private void refreshPlan(SessionContext ctx) {
        try {
            String prompt = prompts.planUpdate(ctx.getPlan(), ctx.getReasoning(), ctx.lastUserMessage());
            String updated = ResponseSections.answerBody(
                    streamed(ModelRole.PLAN_UPDATE, ctx, "plan_update", List.of(Message.user(prompt)))).strip();
            if (!updated.isBlank()) {
                ctx.setPlan(updated);
            }
        } catch (AgentConfigurationException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Plan update failed, keeping the current plan: {}", e.getMessage());
        }
    }

    private WorkflowEvent reason(SessionContext ctx, WorkflowEvent.ReasonInput event) {
        if (ctx.getIterations() >= maxIterations) {
            log.warn("Max iterations reached ({}) [category={}]", maxIterations, ctx.getCategory());
            return new WorkflowEvent.Stop(WorkflowEvent.StopReason.MAX_ITERATIONS,
                    "I was unable to complete the task within " + maxIterations + " reasoning steps.");
        }
        int iteration = ctx.incrementIterations();
        log.info("Reasoning iteration {}/{} [category={}]", iteration, maxIterations, ctx.getCategory());
        observer.onWorkflowEvent("llm_request", "Reasoning step " + iteration,
                eventData(ctx, "iteration", iteration));

        String output = streamed(ModelRole.MAIN, ctx, "reasoning", event.history());

        ReasoningStep step;
        try {
            step = stepParser.parse(ResponseSections.answerBody(output));
        } catch (ReasoningParseException e) {
            log.warn("Could not parse reasoning step: {}", e.getMessage());
            ctx.appendStep(new ReasoningStep.Observation(PARSE_ERROR_PREFIX + e.getMessage()));
            return new WorkflowEvent.PrepareHistory();
        }

        ctx.appendStep(step);
        return step.accept(new ReasoningStep.Visitor<WorkflowEvent>() {
            @Override
            public WorkflowEvent action(ReasoningStep.Action action) {
                return new WorkflowEvent.ToolDispatch(ToolCall.of(action.name(), action.args()));
            }

            @Override
            public WorkflowEvent observation(ReasoningStep.Observation observation) {
                return new WorkflowEvent.PrepareHistory();
            }

            @Override
            public WorkflowEvent milestone(ReasoningStep.Milestone milestone) {
                log.debug("Milestone reached: {}", milestone.note());
                return new WorkflowEvent.PrepareHistory();
            }

            @Override
            public WorkflowEvent fin(ReasoningStep.Final fin) {
                ctx.addMessage(Message.assistant(fin.text()));
                return new WorkflowEvent.Stop(WorkflowEvent.StopReason.FINAL, fin.text());
            }
        });
    }

    private WorkflowEvent toolDispatch(SessionContext ctx, WorkflowEvent.ToolDispatch event) {
        ToolCall call = event.call();
        String tool = call.getToolName();
        String category = ctx.getCategory();

        if (!toolRegistry.isPermitted(tool, category)) {
            log.warn("Tool [{}] is not permitted for category [{}]", tool, category);
            ctx.appendStep(new ReasoningStep.Observation(
                    "Tool '" + tool + "' is not available for category " + category + "."));
            return new WorkflowEvent.PrepareHistory();
        }

        long start = System.currentTimeMillis();
        ToolCall prepared = call;
        String observation;
        try {
            prepared = toolDispatcher.prepare(call,
                    new ToolInjection(category, ctx.lastUserMessage(), ctx.getCachedChunks()));
            observer.onToolCallStart(tool, prepared.getArguments(), category);
            ToolOutput output = resultNormalizer.normalize(tool, toolDispatcher.execute(prepared));
            if (output.chunked()) {
                observation = handleChunks(ctx, prepared, output);
            } else {
                observation = output.text();
                if (!observation.startsWith("ERROR:")) ctx.addSource(observation);
            }
        } catch (AgentConfigurationException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Tool [{}] failed, reporting it to the model: {}", tool, e.getMessage());
            observation = "Tool '" + tool + "' failed: " + e.getMessage();
        }
        long latency = System.currentTimeMillis() - start;

        if (runContext != null) {
            runContext.recordToolCall(tool, prepared.getArguments(), latency, observation, category);
        }
        observer.onToolCallComplete(tool, observation, latency, category);
        ctx.appendStep(new ReasoningStep.Observation(observation));
        return new WorkflowEvent.PrepareHistory();
    }

    private String handleChunks(SessionContext ctx, ToolCall prepared, ToolOutput output) {
        List<String> chunks = output.chunks();
        Object query = prepared.argument("query");
        if (chunkFilter != null && !chunks.isEmpty() && query != null && !query.toString().isBlank()) {
            chunks = chunkFilter.filter(chunks, query.toString(), ctx.getCategory(), observer).relevantChunks();
        }
        ctx.setCachedChunks(chunks);
        ctx.addSources(chunks);
        if (chunks.isEmpty()) return NO_CHUNKS;

        StringBuilder text = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            if (i > 0) text.append('\n');
            text.append('[').append(i + 1).append("] ").append(chunks.get(i));
        }
        return text.toString();
    }

    private WorkflowEvent fanOut(SessionContext ctx, WorkflowEvent.FanOut event) {
        log.info("Fanning out to {} categories: {}", event.categories().size(), event.categories());
        Map<String, WorkflowResult> results = branchLauncher.launch(ctx, event.categories());
        ctx.setBranchResults(results);
        ctx.addSources(BranchResultAggregator.taggedSources(results));

        long completed = results.values().stream().filter(r -> r.getStatus() == WorkflowStatus.COMPLETED).count();
        String response = BranchResultAggregator.combinedResponse(results);
        if (completed > 0) {
            ctx.addMessage(Message.assistant(response));
        }
        observer.onWorkflowEvent("parallel_execution_complete",
                completed + "/" + results.size() + " branches completed",
                eventData(ctx, "summary", BranchResultAggregator.summary(results).get("summary")));
        return new WorkflowEvent.Stop(WorkflowEvent.StopReason.FAN_OUT, response);
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Streams one model call through a section splitter so observers see
     * thinking and output increments live. Returns the complete text.
     */
    private String streamed(ModelRole role, SessionContext ctx, String phase, List<Message> messages) {
        if (runContext != null) runContext.recordModelCall();
        Map<String, Object> metadata = eventData(ctx, "step", phase);
        StreamingResponseSplitter splitter = new StreamingResponseSplitter((type, text) ->
                observer.onStreamingContent(new StreamingContent(phase, type, text, metadata)));

        String full = models.client(role).streamChat(messages, splitter::accept);
        splitter.finish();
        return full == null ? "" : full;
    }

    private String toolCatalogue(String category) {
        try {
            return toolRegistry.describe(category);
        } catch (AgentConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Tool catalogue unavailable: {}", e.getMessage());
            return "(tool catalogue unavailable)";
        }
    }

    private static Map<String, Object> stepData(SessionContext ctx) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("run_id", ctx.getRunId());
        if (ctx.getCategory() != null) data.put("category", ctx.getCategory());
        return data;
    }

    private static Map<String, Object> eventData(SessionContext ctx, String key, Object value) {
        Map<String, Object> data = stepData(ctx);
        if (value != null) data.put(key, value);
        return data;
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    private static final ReasoningStep.Visitor<Message> TRACE_TO_MESSAGE = new ReasoningStep.Visitor<>() {
        @Override
        public Message action(ReasoningStep.Action action) {
            return Message.assistant(action.render());
        }

        @Override
        public Message observation(ReasoningStep.Observation observation) {
            return Message.tool(observation.render());
        }

        @Override
        public Message milestone(ReasoningStep.Milestone milestone) {
            return Message.assistant(milestone.render());
        }

        @Override
        public Message fin(ReasoningStep.Final fin) {
            return Message.assistant(fin.render());
        }
    };
}
