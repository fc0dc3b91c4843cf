package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.resilience.ResilientLlmClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

/**
 * Builds fresh, resilience-wrapped model clients. Every call returns a new
 * instance; callers that need isolation (category pools, filter lanes) never
 * share one.
 */
@Slf4j
public class LlmClientFactory {

    static final String RESILIENCE_INSTANCE = "llmClient";

    private final LlmProperties properties;
    private final ObjectMapper objectMapper;
    private final RestClient.Builder restClientBuilder;
    private final RetryRegistry retryRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public LlmClientFactory(LlmProperties properties,
                            ObjectMapper objectMapper,
                            RestClient.Builder restClientBuilder,
                            RetryRegistry retryRegistry,
                            CircuitBreakerRegistry circuitBreakerRegistry) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restClientBuilder = restClientBuilder;
        this.retryRegistry = retryRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    public LlmClient create(ModelRole role) {
        LlmProviderProperties props = properties.propertiesFor(role);
        log.debug("Creating model client [role={}, provider={}, model={}]",
                role.key(), properties.getProvider(), props.getModel());
        GenericLlmClient raw = new GenericLlmClient(
                props, objectMapper, properties.getProvider(), restClientBuilder.clone());
        return new ResilientLlmClient(raw,
                retryRegistry.retry(RESILIENCE_INSTANCE),
                circuitBreakerRegistry.circuitBreaker(RESILIENCE_INSTANCE));
    }
}
