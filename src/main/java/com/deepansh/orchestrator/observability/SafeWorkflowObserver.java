package com.deepansh.orchestrator.observability;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Shields the engine from observer failures: every callback is invoked
 * inside a try/catch and failures are logged at warn, never rethrown.
 */
@Slf4j
public final class SafeWorkflowObserver implements WorkflowObserver {

    private final WorkflowObserver delegate;

    private SafeWorkflowObserver(WorkflowObserver delegate) {
        this.delegate = delegate;
    }

    public static WorkflowObserver wrap(WorkflowObserver observer) {
        if (observer == null) return NoOpWorkflowObserver.INSTANCE;
        if (observer instanceof SafeWorkflowObserver || observer instanceof NoOpWorkflowObserver) {
            return observer;
        }
        return new SafeWorkflowObserver(observer);
    }

    @Override
    public void onStepStart(String step, Map<String, Object> data) {
        guard("onStepStart", () -> delegate.onStepStart(step, data));
    }

    @Override
    public void onStepComplete(String step, Map<String, Object> data) {
        guard("onStepComplete", () -> delegate.onStepComplete(step, data));
    }

    @Override
    public void onStreamingContent(StreamingContent content) {
        guard("onStreamingContent", () -> delegate.onStreamingContent(content));
    }

    @Override
    public void onToolCallStart(String toolName, Map<String, Object> arguments, String category) {
        guard("onToolCallStart", () -> delegate.onToolCallStart(toolName, arguments, category));
    }

    @Override
    public void onToolCallComplete(String toolName, String result, long latencyMs, String category) {
        guard("onToolCallComplete", () -> delegate.onToolCallComplete(toolName, result, latencyMs, category));
    }

    @Override
    public void onWorkflowEvent(String type, String message, Map<String, Object> metadata) {
        guard("onWorkflowEvent", () -> delegate.onWorkflowEvent(type, message, metadata));
    }

    @Override
    public void onFilterStart(int totalChunks, String query, String category) {
        guard("onFilterStart", () -> delegate.onFilterStart(totalChunks, query, category));
    }

    @Override
    public void onFilterProgress(int lane, int chunkIndex, String chunk, boolean relevant,
                                 String thinking, String category, int score) {
        guard("onFilterProgress", () -> delegate.onFilterProgress(
                lane, chunkIndex, chunk, relevant, thinking, category, score));
    }

    @Override
    public void onFilterComplete(int totalChunks, int relevantCount, int filteredOutCount, String category) {
        guard("onFilterComplete", () -> delegate.onFilterComplete(
                totalChunks, relevantCount, filteredOutCount, category));
    }

    private void guard(String callback, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Observer callback {} failed: {}", callback, e.getMessage());
        }
    }
}
