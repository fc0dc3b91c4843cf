package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.exception.ToolTransportException;
import com.deepansh.orchestrator.model.ToolCall;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Turns an Action into a call on the tool transport.
 *
 * prepare(): injects engine-owned arguments, then prunes to the keys the
 * tool's schema declares plus the injected allow-list.
 *
 * execute(): retries timeouts and transport failures (not tool-level errors)
 * with linear backoff. A "not connected" failure schedules a reconnect ahead
 * of the next attempt. When attempts are exhausted the last failure is
 * rethrown; the reasoning loop turns it into an observation.
 */
@Component
@Slf4j
public class ToolDispatcher {

    static final String DOC_CHUNKS = "doc_chunks";
    static final String QUERY = "query";
    static final String CATEGORY = "category";

    private final ToolTransport transport;
    private final ToolRegistry registry;
    private final ToolProperties properties;
    private final Retry retry;

    public ToolDispatcher(ToolTransport transport,
                          ToolRegistry registry,
                          ToolProperties properties,
                          RetryRegistry retryRegistry) {
        this.transport = transport;
        this.registry = registry;
        this.properties = properties;

        ToolProperties.Dispatch dispatch = properties.getDispatch();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(dispatch.getMaxAttempts())
                .intervalFunction(linearBackoff(dispatch.getBackoff()))
                .retryOnException(e -> e instanceof ToolTransportException)
                .build();
        this.retry = retryRegistry.retry("toolDispatch", config);
    }

    /** Returns a new call with injected and pruned arguments; the input call is untouched. */
    public ToolCall prepare(ToolCall call, ToolInjection injection) {
        Map<String, Object> args = new LinkedHashMap<>(call.getArguments());
        String tool = call.getToolName();

        if (tool.equals(properties.getSummarizeTool())) {
            if (!injection.cachedChunks().isEmpty()) {
                args.put(DOC_CHUNKS, injection.cachedChunks());
            }
            if (isBlank(args.get(QUERY)) && injection.lastUserMessage() != null) {
                args.put(QUERY, injection.lastUserMessage());
            }
        }

        if (tool.equals(properties.getSearchTool())
                && isBlank(args.get(CATEGORY)) && injection.category() != null) {
            args.put(CATEGORY, injection.category());
        }

        return call.withArguments(prune(tool, args));
    }

    public String execute(ToolCall prepared) {
        String tool = prepared.getToolName();
        Duration timeout = properties.timeoutFor(tool);
        AtomicBoolean reconnectFirst = new AtomicBoolean(false);
        AtomicInteger attempt = new AtomicInteger();

        Supplier<String> call = () -> {
            int n = attempt.incrementAndGet();
            if (reconnectFirst.getAndSet(false)) {
                transport.reconnect();
            }
            try {
                log.info("Executing tool: [{}] attempt {}/{} with args: {}",
                        tool, n, properties.getDispatch().getMaxAttempts(), prepared.getArguments().keySet());
                return transport.callTool(tool, prepared.getArguments(), timeout);
            } catch (ToolTransportException e) {
                log.warn("Tool [{}] attempt {} failed: {}", tool, n, e.getMessage());
                if (e.isNotConnected()) {
                    reconnectFirst.set(true);
                }
                throw e;
            }
        };

        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (ToolTransportException e) {
            log.error("Tool [{}] failed after {} attempt(s): {}", tool, attempt.get(), e.getMessage());
            throw e;
        }
    }

    /** Attempt n waits n * step before the next attempt. */
    static IntervalFunction linearBackoff(Duration step) {
        long millis = Math.max(1, step.toMillis());
        return IntervalFunction.of(Duration.ofMillis(millis), previous -> previous + millis);
    }

    private Map<String, Object> prune(String tool, Map<String, Object> args) {
        Optional<ToolDefinition> definition;
        try {
            definition = registry.find(tool);
        } catch (ToolTransportException e) {
            // catalogue unreachable: send the arguments as they are, execute() retries the server
            log.warn("Tool catalogue unavailable, not pruning arguments for [{}]: {}", tool, e.getMessage());
            return args;
        }
        if (definition.isEmpty() || !definition.get().hasDeclaredProperties()) {
            return args;
        }
        Set<String> declared = definition.get().propertyNames();
        List<String> injected = properties.getDispatch().getInjectedArgumentList();

        Map<String, Object> pruned = new LinkedHashMap<>();
        args.forEach((key, value) -> {
            if (declared.contains(key) || injected.contains(key)) {
                pruned.put(key, value);
            } else {
                log.debug("Dropping undeclared argument [{}] for tool [{}]", key, tool);
            }
        });
        return pruned;
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
