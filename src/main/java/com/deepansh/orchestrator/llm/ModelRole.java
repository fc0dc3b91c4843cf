package com.deepansh.orchestrator.llm;

/**
 * The distinct jobs a model client is used for. Each category branch holds
 * one client per role; each filter lane holds its own FILTER client.
 */
public enum ModelRole {
    MAIN("main"),
    PLANNING("planning"),
    PLAN_UPDATE("plan-update"),
    FILTER("filter"),
    INTENT("intent"),
    ENTITY("entity");

    private final String key;

    ModelRole(String key) {
        this.key = key;
    }

    /** Key used under {@code llm.role-models} in application.yml. */
    public String key() {
        return key;
    }
}
