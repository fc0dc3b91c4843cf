package com.deepansh.orchestrator.tool;

import java.util.List;

/**
 * A tool result normalized for the reasoning loop: either a chunk list
 * (routed through the relevance filter) or a plain observation string.
 *
 * {@code rawFallback} marks a search result that could not be parsed and was
 * wrapped as a single chunk verbatim.
 */
public record ToolOutput(List<String> chunks, String text, boolean chunked, boolean rawFallback) {

    public static ToolOutput text(String text) {
        return new ToolOutput(List.of(), text == null ? "" : text, false, false);
    }

    public static ToolOutput chunks(List<String> chunks) {
        return new ToolOutput(List.copyOf(chunks), null, true, false);
    }

    public static ToolOutput rawChunk(String raw) {
        return new ToolOutput(raw == null || raw.isBlank() ? List.of() : List.of(raw), null, true, true);
    }
}
