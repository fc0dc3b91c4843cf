package com.deepansh.orchestrator.plan;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface StoredPlanRepository extends MongoRepository<StoredPlan, String> {

    Optional<StoredPlan> findFirstByQueryAndCategory(String query, String category);
}
