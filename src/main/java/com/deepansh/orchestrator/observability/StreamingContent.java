package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.stream.ContentType;

import java.util.Map;

/**
 * One increment of live model output.
 *
 * @param phase       workflow phase producing it (intent_recognition, planning, reasoning, ...)
 * @param contentType thinking vs. final output
 * @param text        the increment itself
 * @param metadata    step name and, inside a branch, the category
 */
public record StreamingContent(String phase, ContentType contentType, String text, Map<String, Object> metadata) {

    public StreamingContent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
