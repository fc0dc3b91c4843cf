package com.deepansh.orchestrator.plan;

import java.util.Optional;

/**
 * Example-plan storage keyed by exact (query, category).
 * Unknown categories never match and are never written.
 */
public interface PlanStore {

    Optional<String> getPlan(String query, String category);

    void putPlan(String query, String plan, String category);
}
