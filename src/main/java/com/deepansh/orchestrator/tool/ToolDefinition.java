package com.deepansh.orchestrator.tool;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a tool as published by the tool server.
 * Decouples the transport listing format from prompt rendering and pruning.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    /** Keys under the schema's "properties"; empty when the schema declares none. */
    public Set<String> propertyNames() {
        if (inputSchema == null) return Set.of();
        Object properties = inputSchema.get("properties");
        if (properties instanceof Map<?, ?> map) {
            Set<String> names = new LinkedHashSet<>();
            map.keySet().forEach(k -> names.add(String.valueOf(k)));
            return names;
        }
        return Set.of();
    }

    public boolean hasDeclaredProperties() {
        return !propertyNames().isEmpty();
    }

    /** One catalogue entry for the reasoning prompt. */
    public String render() {
        return "> " + name + ": " + (description != null ? description.strip() : "")
                + "\n  arguments: " + propertyNames();
    }
}
