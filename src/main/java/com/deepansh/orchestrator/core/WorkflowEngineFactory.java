package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.branch.CategoryModelPool;
import com.deepansh.orchestrator.branch.CategoryRegistry;
import com.deepansh.orchestrator.branch.ParallelBranchManager;
import com.deepansh.orchestrator.config.AgentProperties;
import com.deepansh.orchestrator.filter.ConcurrentChunkFilter;
import com.deepansh.orchestrator.filter.RelevanceJudge;
import com.deepansh.orchestrator.llm.LlmClientFactory;
import com.deepansh.orchestrator.llm.ModelRole;
import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.observability.WorkflowObserver;
import com.deepansh.orchestrator.plan.PlanStore;
import com.deepansh.orchestrator.tool.ToolDispatcher;
import com.deepansh.orchestrator.tool.ToolRegistry;
import com.deepansh.orchestrator.tool.ToolResultNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Assembles per-run objects from the shared Spring beans.
 *
 * Engines, category registries and branch managers are plain objects owned
 * by one run; only the collaborators they are built from are singletons.
 */
@Component
public class WorkflowEngineFactory {

    private final LlmClientFactory llmClientFactory;
    private final ToolRegistry toolRegistry;
    private final ToolDispatcher toolDispatcher;
    private final ToolResultNormalizer resultNormalizer;
    private final PlanStore planStore;
    private final AgentProperties agentProperties;
    private final Executor filterLaneExecutor;
    private final AsyncTaskExecutor branchExecutor;
    private final StructuredOutputParser outputParser;
    private final ReasoningStepParser stepParser;
    private final WorkflowTemplates templates;
    private final RelevanceJudge relevanceJudge;
    private final EntityMetadataMerger metadataMerger = new EntityMetadataMerger();
    private final PromptFormatter prompts = new PromptFormatter();

    public WorkflowEngineFactory(LlmClientFactory llmClientFactory,
                                 ToolRegistry toolRegistry,
                                 ToolDispatcher toolDispatcher,
                                 ToolResultNormalizer resultNormalizer,
                                 PlanStore planStore,
                                 AgentProperties agentProperties,
                                 ObjectMapper objectMapper,
                                 @Qualifier("filterLaneExecutor") Executor filterLaneExecutor,
                                 @Qualifier("branchExecutor") AsyncTaskExecutor branchExecutor) {
        this.llmClientFactory = llmClientFactory;
        this.toolRegistry = toolRegistry;
        this.toolDispatcher = toolDispatcher;
        this.resultNormalizer = resultNormalizer;
        this.planStore = planStore;
        this.agentProperties = agentProperties;
        this.filterLaneExecutor = filterLaneExecutor;
        this.branchExecutor = branchExecutor;
        this.outputParser = new StructuredOutputParser(objectMapper, agentProperties.getDefaultCategory());
        this.stepParser = new ReasoningStepParser(objectMapper);
        this.templates = new WorkflowTemplates(agentProperties);
        this.relevanceJudge = new RelevanceJudge(agentProperties.getFilter());
    }

    public CategoryRegistry newCategoryRegistry() {
        return new CategoryRegistry(llmClientFactory::create);
    }

    public ParallelBranchManager newBranchManager(CategoryRegistry registry, WorkflowObserver observer,
                                                  RunContext runContext) {
        return new ParallelBranchManager(registry,
                pool -> engine(pool, observer, runContext, null),
                branchExecutor,
                agentProperties.getBranchTimeout());
    }

    /**
     * Engine bound to one category pool. Filter lanes take fresh clients from
     * that pool, one per lane. A null launcher disables fan-out.
     */
    public WorkflowEngine engine(CategoryModelPool pool, WorkflowObserver observer,
                                 RunContext runContext, BranchLauncher launcher) {
        ConcurrentChunkFilter filter = new ConcurrentChunkFilter(
                () -> pool.newClient(ModelRole.FILTER),
                filterLaneExecutor,
                relevanceJudge,
                agentProperties.getFilter());

        return WorkflowEngine.builder()
                .models(pool)
                .toolRegistry(toolRegistry)
                .toolDispatcher(toolDispatcher)
                .resultNormalizer(resultNormalizer)
                .chunkFilter(filter)
                .planStore(planStore)
                .outputParser(outputParser)
                .stepParser(stepParser)
                .metadataMerger(metadataMerger)
                .templates(templates)
                .prompts(prompts)
                .observer(observer)
                .branchLauncher(launcher)
                .runContext(runContext)
                .knownCategories(agentProperties.getCategories().keySet())
                .maxIterations(agentProperties.getMaxIterations())
                .build();
    }
}
