package com.deepansh.orchestrator.branch;

import com.deepansh.orchestrator.core.BranchLauncher;
import com.deepansh.orchestrator.core.SessionContext;
import com.deepansh.orchestrator.core.WorkflowEngine;
import com.deepansh.orchestrator.core.WorkflowOutcome;
import com.deepansh.orchestrator.exception.WorkflowCancelledException;
import com.deepansh.orchestrator.model.WorkflowResult;
import com.deepansh.orchestrator.model.WorkflowStatus;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Runs one isolated workflow branch per category under a shared deadline.
 *
 * Per fan-out:
 * 1. every category gets a deep copy of the parent context, its own model
 *    pool from the {@link CategoryRegistry} and a fresh engine
 * 2. branches are submitted together and awaited in the order the
 *    categories were supplied, each with whatever is left of the deadline
 * 3. a branch still running at the deadline is cancelled and recorded as
 *    TIMEOUT with an empty trace; a branch that threw is FAILED; a branch
 *    cancelled from outside is CANCELLED
 *
 * One manager belongs to one run. {@link #clear()} releases pools and branch
 * handles and may be called more than once.
 */
@Slf4j
public class ParallelBranchManager implements BranchLauncher {

    private final CategoryRegistry registry;
    private final Function<CategoryModelPool, WorkflowEngine> engines;
    private final AsyncTaskExecutor executor;
    private final Duration deadline;
    private final List<Future<WorkflowResult>> handles = new ArrayList<>();
    private final AtomicBoolean cleared = new AtomicBoolean(false);

    public ParallelBranchManager(CategoryRegistry registry,
                                 Function<CategoryModelPool, WorkflowEngine> engines,
                                 AsyncTaskExecutor executor,
                                 Duration deadline) {
        this.registry = registry;
        this.engines = engines;
        this.executor = executor;
        this.deadline = deadline;
    }

    @Override
    public Map<String, WorkflowResult> launch(SessionContext base, List<String> categories) {
        return runBranches(base, categories, deadline);
    }

    public Map<String, WorkflowResult> runBranches(SessionContext base, List<String> categories, Duration timeout) {
        List<String> ordered = new ArrayList<>(new LinkedHashSet<>(categories));
        long deadlineAt = System.nanoTime() + timeout.toNanos();
        log.info("Starting {} branch(es) [categories={}, deadline={}s]", ordered.size(), ordered, timeout.toSeconds());

        Map<String, Future<WorkflowResult>> futures = new LinkedHashMap<>();
        Map<String, Long> startedAt = new LinkedHashMap<>();
        Map<String, WorkflowResult> results = new LinkedHashMap<>();

        for (String category : ordered) {
            SessionContext branchContext = base.copyForBranch(category);
            CategoryModelPool pool = registry.poolFor(category);
            startedAt.put(category, System.nanoTime());
            try {
                Future<WorkflowResult> future = executor.submit(() -> runBranch(category, branchContext, pool));
                futures.put(category, future);
                synchronized (handles) {
                    handles.add(future);
                }
            } catch (TaskRejectedException e) {
                log.error("Branch executor rejected category [{}]: {}", category, e.getMessage());
                results.put(category, failed(category, "branch rejected: " + e.getMessage(), elapsedSince(startedAt.get(category))));
            }
        }

        boolean interrupted = false;
        for (String category : ordered) {
            Future<WorkflowResult> future = futures.get(category);
            if (future == null) continue;
            if (interrupted) {
                future.cancel(true);
                results.put(category, terminal(category, WorkflowStatus.CANCELLED, null, elapsedSince(startedAt.get(category))));
                continue;
            }
            try {
                long remaining = Math.max(0, deadlineAt - System.nanoTime());
                results.put(category, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                Duration elapsed = elapsedSince(startedAt.get(category));
                log.warn("Branch [{}] missed the deadline after {}ms, cancelled", category, elapsed.toMillis());
                results.put(category, terminal(category, WorkflowStatus.TIMEOUT, null, elapsed));
            } catch (ExecutionException e) {
                results.put(category, fromFailure(category, e.getCause(), elapsedSince(startedAt.get(category))));
            } catch (CancellationException e) {
                log.warn("Branch [{}] was cancelled", category);
                results.put(category, terminal(category, WorkflowStatus.CANCELLED, null, elapsedSince(startedAt.get(category))));
            } catch (InterruptedException e) {
                log.warn("Interrupted while awaiting branches, cancelling all");
                interrupted = true;
                cancelAll();
                results.put(category, terminal(category, WorkflowStatus.CANCELLED, null, elapsedSince(startedAt.get(category))));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        Map<String, WorkflowResult> orderedResults = new LinkedHashMap<>();
        ordered.forEach(c -> orderedResults.put(c, results.get(c)));
        log.info("Branches settled [{}]", BranchResultAggregator.countByStatus(orderedResults));
        return orderedResults;
    }

    public void cancelAll() {
        synchronized (handles) {
            handles.forEach(f -> f.cancel(true));
        }
    }

    /** Cancels anything still running and releases every pool and handle. Idempotent. */
    public void clear() {
        if (!cleared.compareAndSet(false, true)) return;
        cancelAll();
        synchronized (handles) {
            handles.clear();
        }
        registry.clear();
    }

    private WorkflowResult runBranch(String category, SessionContext context, CategoryModelPool pool) {
        long start = System.nanoTime();
        MDC.put("category", category);
        try {
            log.info("Branch started [category={}]", category);
            WorkflowOutcome outcome = engines.apply(pool).runBranch(context);
            Duration elapsed = elapsedSince(start);
            log.info("Branch completed [category={}, iterations={}, latency={}ms]",
                    category, outcome.iterations(), elapsed.toMillis());
            return WorkflowResult.builder()
                    .category(category)
                    .status(WorkflowStatus.COMPLETED)
                    .reasoning(context.reasoningSnapshot())
                    .sources(context.sourcesSnapshot())
                    .response(outcome.response())
                    .elapsed(elapsed)
                    .build();
        } finally {
            MDC.remove("category");
        }
    }

    private WorkflowResult fromFailure(String category, Throwable cause, Duration elapsed) {
        if (cause instanceof WorkflowCancelledException || cause instanceof CancellationException) {
            log.warn("Branch [{}] stopped on cancellation", category);
            return terminal(category, WorkflowStatus.CANCELLED, null, elapsed);
        }
        String message = cause == null ? "unknown error"
                : cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.error("Branch [{}] failed: {}", category, message, cause);
        return failed(category, message, elapsed);
    }

    private static WorkflowResult failed(String category, String error, Duration elapsed) {
        return terminal(category, WorkflowStatus.FAILED, error, elapsed);
    }

    private static WorkflowResult terminal(String category, WorkflowStatus status, String error, Duration elapsed) {
        return WorkflowResult.builder()
                .category(category)
                .status(status)
                .error(error)
                .elapsed(elapsed)
                .build();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
