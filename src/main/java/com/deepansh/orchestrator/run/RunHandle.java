package com.deepansh.orchestrator.run;

import com.deepansh.orchestrator.branch.ParallelBranchManager;
import com.deepansh.orchestrator.observability.RunContext;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.Future;

/**
 * Live state of one run: its status plus whatever is needed to stop it.
 *
 * The worker binds its {@link RunContext} and branch manager when the run
 * starts; the controller attaches the executor future for streamed runs.
 * Either may arrive after a cancel, in which case it is stopped on arrival.
 * The stop callback lets a streaming client learn that a queued run will
 * never start.
 */
@Slf4j
@Getter
public class RunHandle {

    private final String runId;
    private final String sessionId;
    private final String userId;
    private final String input;
    private final Instant createdAt;
    private final Instant deadline;

    private volatile RunStatus status = RunStatus.PENDING;
    private volatile String error;
    private volatile Instant updatedAt;

    @Getter(AccessLevel.NONE)
    private RunContext runContext;
    @Getter(AccessLevel.NONE)
    private ParallelBranchManager branchManager;
    @Getter(AccessLevel.NONE)
    private Future<?> future;
    @Getter(AccessLevel.NONE)
    private volatile Runnable onStop;

    RunHandle(String runId, String sessionId, String userId, String input, Instant createdAt, Instant deadline) {
        this.runId = runId;
        this.sessionId = sessionId;
        this.userId = userId;
        this.input = input;
        this.createdAt = createdAt;
        this.deadline = deadline;
        this.updatedAt = createdAt;
    }

    /** Called by the worker thread once the run's context exists. */
    public void start(RunContext runContext, ParallelBranchManager branchManager) {
        boolean stopNow;
        synchronized (this) {
            this.runContext = runContext;
            this.branchManager = branchManager;
            stopNow = status.isTerminal();
            if (!stopNow) {
                status = RunStatus.RUNNING;
                updatedAt = Instant.now();
            }
        }
        if (stopNow) interrupt();
    }

    public void attach(Future<?> future) {
        boolean stopNow;
        synchronized (this) {
            this.future = future;
            stopNow = status.isTerminal();
        }
        if (stopNow) future.cancel(true);
    }

    public void onStop(Runnable callback) {
        this.onStop = callback;
    }

    public boolean complete() {
        return transition(RunStatus.COMPLETED, null);
    }

    public boolean fail(String error) {
        return transition(RunStatus.FAILED, error);
    }

    /** Stops the run and its branches. Returns false when it had already finished. */
    public boolean cancel(String reason) {
        if (!transition(RunStatus.CANCELLED, reason)) return false;
        log.info("Run cancelled [runId={}, reason={}]", runId, reason);
        interrupt();
        return true;
    }

    /** Marks an overdue run failed and stops it. */
    boolean expire(Instant now) {
        if (!now.isAfter(deadline)) return false;
        if (!transition(RunStatus.FAILED, "Run timed out")) return false;
        log.warn("Run timed out [runId={}, deadline={}]", runId, deadline);
        interrupt();
        return true;
    }

    public RunSummary summary() {
        return new RunSummary(runId, sessionId, userId, status.label(), input, error, createdAt, updatedAt, deadline);
    }

    private synchronized boolean transition(RunStatus next, String reason) {
        if (status.isTerminal()) return false;
        status = next;
        error = reason;
        updatedAt = Instant.now();
        return true;
    }

    private void interrupt() {
        RunContext ctx;
        ParallelBranchManager branches;
        Future<?> worker;
        synchronized (this) {
            ctx = runContext;
            branches = branchManager;
            worker = future;
        }
        if (ctx != null) ctx.cancel();
        if (branches != null) branches.cancelAll();
        if (worker != null) worker.cancel(true);
        Runnable callback = onStop;
        if (callback != null) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Stop callback failed for run [{}]: {}", runId, e.getMessage());
            }
        }
    }
}
