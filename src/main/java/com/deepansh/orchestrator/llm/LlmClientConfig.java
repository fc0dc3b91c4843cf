package com.deepansh.orchestrator.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.Map;

/**
 * Wires the model client factory for the provider selected by LLM_PROVIDER.
 * Fails fast at startup when that provider has no base URL.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    private static final Map<String, String> KEY_PAGES = Map.of(
            "openai", "https://platform.openai.com/api-keys",
            "groq", "https://console.groq.com/keys",
            "gemini", "https://aistudio.google.com/app/apikey",
            "dashscope", "https://dashscope.console.aliyun.com/apiKey");

    private final LlmProperties properties;

    public LlmClientConfig(LlmProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void logActiveProvider() {
        LlmProviderProperties active = properties.activeProvider();
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", properties.getProvider().toUpperCase());
        log.info("  Model               : {}", active.getModel());
        properties.getRoleModels().forEach((role, model) ->
                log.info("  Role override       : {} -> {}", role, model));
        logKey(properties.getProvider(), active.getApiKey());
        log.info("================================================================");
    }

    @Bean
    public LlmClientFactory llmClientFactory(ObjectMapper objectMapper,
                                             RestClient.Builder restClientBuilder,
                                             RetryRegistry retryRegistry,
                                             CircuitBreakerRegistry circuitBreakerRegistry) {
        return new LlmClientFactory(properties, objectMapper, restClientBuilder,
                retryRegistry, circuitBreakerRegistry);
    }

    private void logKey(String provider, String key) {
        String envVar = provider.toUpperCase() + "_API_KEY";
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", provider.toUpperCase(), envVar);
            log.error("  Get a key at: {}", KEY_PAGES.getOrDefault(provider, "your provider console"));
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
