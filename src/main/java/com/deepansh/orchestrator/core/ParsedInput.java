package com.deepansh.orchestrator.core;

import java.util.List;
import java.util.Map;

/**
 * Request text unpacked into the query the workflow reasons about, caller
 * metadata and attachment references.
 */
public record ParsedInput(String query, Map<String, Object> metadata, List<Object> attachments) {

    public ParsedInput {
        query = query == null ? "" : query;
        metadata = metadata == null ? Map.of() : metadata;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static ParsedInput plain(String text) {
        return new ParsedInput(text, Map.of(), List.of());
    }
}
