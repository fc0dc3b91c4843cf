package com.deepansh.orchestrator.resilience;

import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.model.Message;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Decorator around a model client that adds retry + circuit breaker.
 *
 * Clients are created per category and per filter lane at run time, so the
 * resilience4j instances are applied programmatically instead of through
 * annotations on a singleton bean. All clients share the "llmClient" retry
 * and circuit breaker from the registries, configured in application.yml:
 * - 3 attempts, exponential backoff: 2s, 4s, 8s
 * - Opens after 50% failure rate in sliding window of 20 calls
 * - AgentException is ignored by both (client errors are not transient)
 *
 * Exhausted retries and an open circuit surface as AgentException; the
 * caller decides whether that ends a branch, defaults a chunk, or becomes
 * an observation.
 */
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public ResilientLlmClient(LlmClient delegate, Retry retry, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String complete(String prompt) {
        return call(() -> delegate.complete(prompt));
    }

    @Override
    public String streamChat(List<Message> messages, Consumer<String> onDelta) {
        return call(() -> delegate.streamChat(messages, onDelta));
    }

    private String call(Supplier<String> supplier) {
        Supplier<String> decorated = Retry.decorateSupplier(retry,
                CircuitBreaker.decorateSupplier(circuitBreaker, supplier));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            log.error("LLM circuit breaker is OPEN, rejecting call: {}", e.getMessage());
            throw new AgentException("The model service is currently unavailable (circuit open)", e);
        } catch (AgentException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("LLM call failed after all retries: {}", e.getMessage());
            throw new AgentException("Model call failed after retries: " + e.getMessage(), e);
        }
    }
}
