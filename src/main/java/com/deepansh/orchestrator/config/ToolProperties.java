package com.deepansh.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly-typed configuration for the tool transport and dispatcher.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    /** Tool whose output is a ranked chunk list routed through the relevance filter. */
    private String searchTool = "search_documents";

    /** Tool that summarizes the cached relevant chunks. */
    private String summarizeTool = "conclude_document_chunks";

    private Mcp mcp = new Mcp();
    private Dispatch dispatch = new Dispatch();
    private Http http = new Http();

    public Duration timeoutFor(String toolName) {
        return dispatch.getTimeouts().getOrDefault(toolName, dispatch.getDefaultTimeout());
    }

    @Data
    public static class Mcp {
        private String baseUrl = "";
        private String endpoint = "/mcp";
        private String protocolVersion = "2024-11-05";
        private String clientName = "reasoning-orchestrator";
    }

    @Data
    public static class Dispatch {
        private int maxAttempts = 3;
        /** Linear backoff step: attempt n waits n * backoff. */
        private Duration backoff = Duration.ofSeconds(2);
        private Duration defaultTimeout = Duration.ofSeconds(60);
        private Map<String, Duration> timeouts = new LinkedHashMap<>();
        /** Comma-separated keys the engine injects itself; kept even when absent from a schema. */
        private String injectedArguments = "doc_chunks,category";

        public List<String> getInjectedArgumentList() {
            if (injectedArguments == null || injectedArguments.isBlank()) return List.of();
            return Arrays.stream(injectedArguments.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }
    }

    @Data
    public static class Http {
        private int maxTotal = 50;
        private int maxPerRoute = 20;
        private Duration connectTimeout = Duration.ofSeconds(10);
        /** Long enough for a streamed model response. */
        private Duration responseTimeout = Duration.ofMinutes(5);
    }
}
