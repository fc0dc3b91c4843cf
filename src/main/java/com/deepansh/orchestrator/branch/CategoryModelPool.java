package com.deepansh.orchestrator.branch;

import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.llm.ModelRole;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Model clients owned by one category. Each role's client is created on
 * first use and reused for the rest of the run; no other category ever
 * receives one of these instances.
 */
@Slf4j
public class CategoryModelPool {

    private final String category;
    private final Function<ModelRole, LlmClient> creator;
    private final Map<ModelRole, LlmClient> clients = new EnumMap<>(ModelRole.class);

    public CategoryModelPool(String category, Function<ModelRole, LlmClient> creator) {
        this.category = category;
        this.creator = creator;
    }

    public synchronized LlmClient client(ModelRole role) {
        return clients.computeIfAbsent(role, r -> {
            log.debug("Creating {} client for category [{}]", r.key(), category);
            return creator.apply(r);
        });
    }

    /** A fresh, unpooled client; used where every caller needs its own instance. */
    public LlmClient newClient(ModelRole role) {
        return creator.apply(role);
    }

    public String category() {
        return category;
    }

    public synchronized int size() {
        return clients.size();
    }

    synchronized void release() {
        clients.clear();
    }
}
