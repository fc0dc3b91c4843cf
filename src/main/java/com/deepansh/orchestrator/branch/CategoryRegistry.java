package com.deepansh.orchestrator.branch;

import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.llm.ModelRole;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Category to model-pool map for one run.
 *
 * Constructed per run and handed to the branch manager; nothing here is
 * process-wide. Pools are created on first reference and dropped by
 * {@link #clear()}, which may be called any number of times.
 */
@Slf4j
public class CategoryRegistry {

    private final Function<ModelRole, LlmClient> creator;
    private final Map<String, CategoryModelPool> pools = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public CategoryRegistry(Function<ModelRole, LlmClient> creator) {
        this.creator = creator;
    }

    public CategoryModelPool poolFor(String category) {
        lock.lock();
        try {
            return pools.computeIfAbsent(category, c -> new CategoryModelPool(c, creator));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pools.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            if (pools.isEmpty()) return;
            pools.values().forEach(CategoryModelPool::release);
            log.debug("Released {} category model pool(s)", pools.size());
            pools.clear();
        } finally {
            lock.unlock();
        }
    }
}
