package com.deepansh.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated thread pools, isolated from the web thread pool.
 *
 * - runExecutor: streamed runs, detached from the servlet thread
 * - branchExecutor: one task per category branch; sized above the largest
 *   expected fan-out so branches never queue behind each other
 * - filterLaneExecutor: relevance-filter lanes (max 3 per filter pass, a
 *   few passes may run at once across branches)
 * - toolCallExecutor: blocking tool transport calls awaited with a timeout
 * - observerExecutor: drains streaming observers so slow SSE clients never
 *   block the engine
 * - traceTaskExecutor: @Async trace persistence
 *
 * All pools propagate MDC so log lines keep the run id and category.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "runExecutor")
    public ThreadPoolTaskExecutor runExecutor() {
        return pool("run-", 4, 16, 50);
    }

    @Bean(name = "branchExecutor")
    public ThreadPoolTaskExecutor branchExecutor() {
        return pool("branch-", 8, 16, 32);
    }

    @Bean(name = "filterLaneExecutor")
    public ThreadPoolTaskExecutor filterLaneExecutor() {
        return pool("filter-lane-", 9, 24, 100);
    }

    @Bean(name = "toolCallExecutor")
    public ThreadPoolTaskExecutor toolCallExecutor() {
        return pool("tool-call-", 4, 16, 50);
    }

    @Bean(name = "observerExecutor")
    public ThreadPoolTaskExecutor observerExecutor() {
        return pool("observer-", 2, 8, 100);
    }

    @Bean(name = "traceTaskExecutor")
    public ThreadPoolTaskExecutor traceTaskExecutor() {
        return pool("trace-async-", 2, 5, 50);
    }

    private ThreadPoolTaskExecutor pool(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
