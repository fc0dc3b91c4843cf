package com.deepansh.orchestrator.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AgentRunTraceRepository extends MongoRepository<AgentRunTrace, String> {

    List<AgentRunTrace> findByUserIdOrderByCreatedAtDesc(String userId);

    List<AgentRunTrace> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    Optional<AgentRunTrace> findByRunId(String runId);

    /** Runs that touched a category, either as the single category or as one fan-out branch. */
    List<AgentRunTrace> findByCategoriesContainingOrderByCreatedAtDesc(String category);

    @Query(value = "{ 'userId': ?0, 'createdAt': { $gte: ?1 } }", count = true)
    long countRecentByUser(String userId, Instant since);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: null, avg: { $avg: '$totalLatencyMs' } } }"
    })
    Double avgLatencyForUser(String userId);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: '$status', count: { $sum: 1 } } }"
    })
    List<GroupCount> statusBreakdownForUser(String userId);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $unwind: '$categories' }",
        "{ $group: { _id: '$categories', count: { $sum: 1 } } }"
    })
    List<GroupCount> categoryBreakdownForUser(String userId);

    /** One $group row: the grouped key and its count. */
    record GroupCount(String id, long count) {}
}
