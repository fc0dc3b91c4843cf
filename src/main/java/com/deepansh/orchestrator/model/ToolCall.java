package com.deepansh.orchestrator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation requested by the reasoning loop.
 *
 * Arguments are frozen at construction. Argument injection before dispatch
 * produces a new instance through {@link #withArguments(Map)} instead of
 * mutating this one.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ToolCall {

    private final String toolName;
    private final Map<String, Object> arguments;

    public ToolCall(String toolName, Map<String, Object> arguments) {
        this.toolName = toolName;
        this.arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolCall of(String toolName, Map<String, Object> arguments) {
        return new ToolCall(toolName, arguments);
    }

    public ToolCall withArguments(Map<String, Object> newArguments) {
        return new ToolCall(toolName, newArguments);
    }

    public Object argument(String key) {
        return arguments.get(key);
    }
}
