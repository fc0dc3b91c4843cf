package com.deepansh.orchestrator.plan;

import com.deepansh.orchestrator.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * MongoDB-backed plan store.
 *
 * Store failures are logged and swallowed; planning then proceeds without
 * example plans. Unknown categories are neither read nor written.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MongoPlanStore implements PlanStore {

    private final StoredPlanRepository repository;
    private final AgentProperties agentProperties;

    @Override
    public Optional<String> getPlan(String query, String category) {
        if (!agentProperties.isKnownCategory(category)) {
            log.debug("Plan lookup skipped for unknown category [{}]", category);
            return Optional.empty();
        }
        try {
            return repository.findFirstByQueryAndCategory(query, category).map(StoredPlan::getPlan);
        } catch (RuntimeException e) {
            log.warn("Plan lookup failed [category={}]: {}", category, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void putPlan(String query, String plan, String category) {
        if (!agentProperties.isKnownCategory(category) || plan == null || plan.isBlank()) {
            return;
        }
        try {
            StoredPlan stored = repository.findFirstByQueryAndCategory(query, category)
                    .orElseGet(() -> StoredPlan.builder().query(query).category(category).build());
            stored.setPlan(plan);
            repository.save(stored);
            log.info("Plan stored [category={}, chars={}]", category, plan.length());
        } catch (RuntimeException e) {
            log.warn("Plan store write failed [category={}]: {}", category, e.getMessage());
        }
    }
}
