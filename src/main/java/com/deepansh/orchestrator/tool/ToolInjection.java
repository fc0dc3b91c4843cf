package com.deepansh.orchestrator.tool;

import java.util.List;

/**
 * Values the engine supplies to tool calls instead of trusting the model.
 *
 * @param category        current workflow category, may be null
 * @param lastUserMessage latest user turn, used as a fallback query
 * @param cachedChunks    relevant chunks kept from the last filtered search
 */
public record ToolInjection(String category, String lastUserMessage, List<String> cachedChunks) {

    public ToolInjection {
        cachedChunks = cachedChunks == null ? List.of() : List.copyOf(cachedChunks);
    }
}
