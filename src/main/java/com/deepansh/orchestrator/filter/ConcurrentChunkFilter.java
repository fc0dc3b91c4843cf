package com.deepansh.orchestrator.filter;

import com.deepansh.orchestrator.config.AgentProperties;
import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.model.ChunkScore;
import com.deepansh.orchestrator.observability.SafeWorkflowObserver;
import com.deepansh.orchestrator.observability.WorkflowObserver;
import com.deepansh.orchestrator.stream.ResponseSections;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Judges chunk relevance with a fixed number of worker lanes.
 *
 * Per pass:
 * 1. chunks are partitioned into at most maxLanes batches
 * 2. each lane takes a fresh model client from the supplier and works its
 *    batch strictly in order, one blocking call per chunk
 * 3. a failed chunk call yields relevant/fallback-score; a lane that cannot
 *    run at all yields that verdict for its whole batch
 * 4. verdicts are merged back into input order and returned as a
 *    {@link FilterOutcome}; callers take relevantChunks() for the ranked list
 *
 * Observer callbacks go through {@link SafeWorkflowObserver} and are invoked
 * from lane threads, so the observer must tolerate concurrent calls.
 */
@Slf4j
public class ConcurrentChunkFilter {

    private final Supplier<LlmClient> laneClients;
    private final Executor laneExecutor;
    private final RelevanceJudge judge;
    private final AgentProperties.Filter config;

    public ConcurrentChunkFilter(Supplier<LlmClient> laneClients,
                                 Executor laneExecutor,
                                 RelevanceJudge judge,
                                 AgentProperties.Filter config) {
        this.laneClients = laneClients;
        this.laneExecutor = laneExecutor;
        this.judge = judge;
        this.config = config;
    }

    public FilterOutcome filter(List<String> chunks, String query, String category, WorkflowObserver observer) {
        WorkflowObserver safe = SafeWorkflowObserver.wrap(observer);
        safe.onFilterStart(chunks.size(), query, category);
        if (chunks.isEmpty()) {
            safe.onFilterComplete(0, 0, 0, category);
            return FilterOutcome.empty();
        }

        List<List<String>> batches = ChunkBatchPartitioner.partition(
                chunks, config.getMaxLanes(), config.getChunksPerLane());
        log.info("Filtering {} chunks in {} lane(s) [category={}]", chunks.size(), batches.size(), category);

        AtomicBoolean cancelled = new AtomicBoolean(false);
        List<CompletableFuture<List<ChunkScore>>> lanes = new ArrayList<>();
        int offset = 0;
        for (int lane = 0; lane < batches.size(); lane++) {
            Lane work = new Lane(lane, offset, batches.get(lane), query, category, safe, cancelled);
            offset += batches.get(lane).size();
            lanes.add(submit(work));
        }

        List<ChunkScore> merged = new ArrayList<>(chunks.size());
        try {
            for (int lane = 0; lane < lanes.size(); lane++) {
                merged.addAll(awaitLane(lanes.get(lane), batches.get(lane)));
            }
        } catch (InterruptedException e) {
            cancelled.set(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Chunk filtering interrupted [category=" + category + "]");
        }

        FilterOutcome outcome = new FilterOutcome(merged);
        int relevant = outcome.relevantCount();
        log.info("Filter complete: {}/{} chunks relevant [category={}]", relevant, outcome.total(), category);
        safe.onFilterComplete(outcome.total(), relevant, outcome.total() - relevant, category);
        return outcome;
    }

    private CompletableFuture<List<ChunkScore>> submit(Lane work) {
        try {
            return CompletableFuture.supplyAsync(work::run, laneExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Lane executor saturated, running lane {} on the caller thread", work.index);
            return CompletableFuture.completedFuture(work.run());
        }
    }

    private List<ChunkScore> awaitLane(CompletableFuture<List<ChunkScore>> future, List<String> batch)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("Filter lane failed, keeping its {} chunk(s): {}", batch.size(), e.getCause().getMessage());
            return batch.stream().map(judge::fallback).toList();
        }
    }

    private final class Lane {
        private final int index;
        private final int offset;
        private final List<String> batch;
        private final String query;
        private final String category;
        private final WorkflowObserver observer;
        private final AtomicBoolean cancelled;

        Lane(int index, int offset, List<String> batch, String query, String category,
             WorkflowObserver observer, AtomicBoolean cancelled) {
            this.index = index;
            this.offset = offset;
            this.batch = batch;
            this.query = query;
            this.category = category;
            this.observer = observer;
            this.cancelled = cancelled;
        }

        List<ChunkScore> run() {
            LlmClient client;
            try {
                client = laneClients.get();
            } catch (RuntimeException e) {
                log.warn("Lane {} could not get a model client, keeping its {} chunk(s): {}",
                        index, batch.size(), e.getMessage());
                return batch.stream().map(judge::fallback).toList();
            }

            List<ChunkScore> scores = new ArrayList<>(batch.size());
            for (int i = 0; i < batch.size(); i++) {
                String chunk = batch.get(i);
                if (cancelled.get()) {
                    scores.add(judge.fallback(chunk));
                    continue;
                }
                ChunkScore score;
                String thinking = "";
                try {
                    String output = client.complete(judge.prompt(query, chunk));
                    score = judge.judge(chunk, output);
                    thinking = thinkingOf(output);
                } catch (RuntimeException e) {
                    log.warn("Relevance call failed for chunk {} in lane {}, keeping it: {}",
                            offset + i, index, e.getMessage());
                    score = judge.fallback(chunk);
                }
                scores.add(score);
                observer.onFilterProgress(index, offset + i, chunk, score.relevant(), thinking, category, score.score());
            }
            return scores;
        }

        private String thinkingOf(String output) {
            String section = ResponseSections.extractThinkingSection(output);
            return section.isEmpty() ? ResponseSections.extractThinking(output) : section;
        }
    }
}
