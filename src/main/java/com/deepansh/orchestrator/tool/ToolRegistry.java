package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Catalogue of tools published by the tool server, indexed by name.
 *
 * The listing is fetched once and cached; {@link #refresh()} forces a new
 * listing. Each category may restrict the catalogue through its tool
 * whitelist ({@code agent.categories.<id>.tools}). An unknown category, or
 * no category at all, falls back to the {@code default} entry; with no
 * applicable whitelist every tool is permitted.
 */
@Component
@Slf4j
public class ToolRegistry {

    static final String DEFAULT_ENTRY = "default";

    private final ToolTransport transport;
    private final AgentProperties agentProperties;
    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();
    private volatile boolean loaded;

    public ToolRegistry(ToolTransport transport, AgentProperties agentProperties) {
        this.transport = transport;
        this.agentProperties = agentProperties;
    }

    public List<ToolDefinition> getAllDefinitions() {
        ensureLoaded();
        return tools.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .collect(Collectors.toList());
    }

    public Optional<ToolDefinition> find(String name) {
        ensureLoaded();
        return Optional.ofNullable(tools.get(name));
    }

    public List<ToolDefinition> definitionsFor(String category) {
        return getAllDefinitions().stream()
                .filter(tool -> isPermitted(tool.getName(), category))
                .collect(Collectors.toList());
    }

    public boolean isPermitted(String toolName, String category) {
        List<String> whitelist = agentProperties.category(category)
                .or(() -> agentProperties.category(DEFAULT_ENTRY))
                .map(AgentProperties.Category::getTools)
                .orElse(List.of());
        return whitelist.isEmpty() || whitelist.contains(toolName);
    }

    /** Tool catalogue block for the reasoning and planning prompts. */
    public String describe(String category) {
        List<ToolDefinition> permitted = definitionsFor(category);
        if (permitted.isEmpty()) return "(no tools available)";
        return permitted.stream().map(ToolDefinition::render).collect(Collectors.joining("\n"));
    }

    public synchronized void refresh() {
        List<ToolDefinition> listed = transport.listTools();
        tools.clear();
        listed.forEach(tool -> {
            tools.put(tool.getName(), tool);
            log.info("Registered tool: [{}] {}", tool.getName(), abbreviate(tool.getDescription()));
        });
        loaded = true;
        log.info("Total tools registered: {}", tools.size());
    }

    public int toolCount() {
        ensureLoaded();
        return tools.size();
    }

    private void ensureLoaded() {
        if (!loaded) {
            synchronized (this) {
                if (!loaded) refresh();
            }
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 80 ? s : s.substring(0, 80) + "...";
    }
}
