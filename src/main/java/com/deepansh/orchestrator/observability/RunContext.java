package com.deepansh.orchestrator.observability;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable per-run collector for observability data.
 * Created at the start of each run, shared by every branch of it,
 * then flushed to {@link AgentRunTrace} at the end.
 *
 * Branches record concurrently, so all state is thread-safe.
 */
@Getter
public class RunContext {

    private final String runId;
    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new CopyOnWriteArrayList<>();
    private final AtomicInteger modelCalls = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RunContext(String runId) {
        this.runId = runId;
    }

    public void recordToolCall(String toolName, Object args, long latencyMs, String result, String category) {
        toolCallRecords.add(new ToolCallRecord(toolName, args, latencyMs, result, category));
    }

    public void recordModelCall() {
        modelCalls.incrementAndGet();
    }

    /** Asks every engine of this run to stop before its next step. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public record ToolCallRecord(
            String toolName,
            Object args,
            long latencyMs,
            String result,
            String category
    ) {}
}
