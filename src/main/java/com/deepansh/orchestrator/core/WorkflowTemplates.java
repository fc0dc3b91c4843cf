package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.config.AgentProperties;

/**
 * Resolves the planning template of a workflow category from
 * {@code agent.categories.<id>.template}.
 */
public class WorkflowTemplates {

    private final AgentProperties properties;

    public WorkflowTemplates(AgentProperties properties) {
        this.properties = properties;
    }

    /** Template of the category, or the default category's template when it has none. */
    public String templateFor(String category) {
        String template = properties.category(category)
                .map(AgentProperties.Category::getTemplate)
                .orElse("");
        return template == null || template.isBlank() ? defaultTemplate() : template;
    }

    public String defaultTemplate() {
        return properties.category(properties.getDefaultCategory())
                .map(AgentProperties.Category::getTemplate)
                .orElse("");
    }
}
