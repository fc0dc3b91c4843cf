package com.deepansh.orchestrator.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persists a full trace of every orchestration run to MongoDB.
 *
 * Captures:
 * - Input / output
 * - Total latency, model call count and per-tool latency
 * - Recognized categories and the status of every branch
 * - Tool execution sequence
 * - Failure details if the run errored
 */
@Document(collection = "agent_run_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunTrace {

    public enum Status { SUCCESS, QUICK_RESPONSE, PARTIAL, MAX_ITERATIONS, CANCELLED, ERROR }

    @Id
    private String id;

    @Indexed
    private String runId;

    @Indexed
    private String sessionId;

    @Indexed
    private String userId;

    private String userInput;
    private String finalAnswer;

    @Indexed
    private Status status;

    private int iterationsUsed;
    private long totalLatencyMs;
    private int modelCalls;

    private List<String> categories;

    /** category → completed / failed / timeout / cancelled */
    private Map<String, String> branchStatuses;

    /**
     * JSON array of tool calls in execution order.
     * E.g: [{"toolName":"search_documents","category":"technical-troubleshooting","latencyMs":340}]
     */
    private String toolCallsJson;

    /** Error message if status = ERROR */
    private String errorMessage;

    @CreatedDate
    @Indexed
    private Instant createdAt;
}
