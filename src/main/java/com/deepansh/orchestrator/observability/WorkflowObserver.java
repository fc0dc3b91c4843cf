package com.deepansh.orchestrator.observability;

import java.util.Map;

/**
 * Progress sink for every orchestration component.
 *
 * All methods default to no-ops so an implementation only overrides what it
 * forwards. Implementations must return quickly; anything that talks to a
 * client does its work off the calling thread.
 */
public interface WorkflowObserver {

    default void onStepStart(String step, Map<String, Object> data) { }

    default void onStepComplete(String step, Map<String, Object> data) { }

    default void onStreamingContent(StreamingContent content) { }

    default void onToolCallStart(String toolName, Map<String, Object> arguments, String category) { }

    default void onToolCallComplete(String toolName, String result, long latencyMs, String category) { }

    /** Named lifecycle events: quick_response_triggered, plan_generation_complete, ... */
    default void onWorkflowEvent(String type, String message, Map<String, Object> metadata) { }

    default void onFilterStart(int totalChunks, String query, String category) { }

    default void onFilterProgress(int lane, int chunkIndex, String chunk, boolean relevant,
                                  String thinking, String category, int score) { }

    default void onFilterComplete(int totalChunks, int relevantCount, int filteredOutCount, String category) { }
}
