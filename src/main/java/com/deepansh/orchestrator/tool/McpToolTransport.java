package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.exception.AgentConfigurationException;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.exception.ToolTimeoutException;
import com.deepansh.orchestrator.exception.ToolTransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MCP client over streamable HTTP (JSON-RPC 2.0, protocol 2024-11-05).
 *
 * Session lifecycle:
 * - the first call performs initialize + notifications/initialized and
 *   keeps the Mcp-Session-Id header the server returns
 * - a 404, or an error mentioning the session, means the server dropped it:
 *   the id is cleared and a "not connected" ToolTransportException is raised
 *   so the dispatcher reconnects before its next attempt
 *
 * Responses may be plain JSON or a single SSE frame; both are accepted.
 * Each tools/call runs on the tool-call executor and is awaited with the
 * per-tool timeout.
 */
@Component
@Slf4j
public class McpToolTransport implements ToolTransport {

    private static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final List<String> SESSION_LOST_HINTS =
            List.of("not found", "invalid", "expired", "unknown", "missing", "terminated");

    private final ToolProperties properties;
    private final ObjectMapper objectMapper;
    private final RestClient.Builder restClientBuilder;
    private final Executor executor;
    private final AtomicLong requestIds = new AtomicLong();

    private volatile RestClient restClient;
    private volatile String sessionId;
    private volatile boolean connected;

    public McpToolTransport(ToolProperties properties,
                            ObjectMapper objectMapper,
                            RestClient.Builder restClientBuilder,
                            @Qualifier("toolCallExecutor") Executor executor) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restClientBuilder = restClientBuilder;
        this.executor = executor;
    }

    @Override
    public List<ToolDefinition> listTools() {
        ensureConnected();
        JsonNode result = request("tools/list", Map.of());
        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode tool : result.path("tools")) {
            tools.add(ToolDefinition.builder()
                    .name(tool.path("name").asText())
                    .description(tool.path("description").asText(""))
                    .inputSchema(toMap(tool.path("inputSchema")))
                    .build());
        }
        log.info("Listed {} tools from MCP server", tools.size());
        return tools;
    }

    @Override
    public String callTool(String name, Map<String, Object> arguments, Duration timeout) {
        ensureConnected();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments);

        CompletableFuture<JsonNode> future =
                CompletableFuture.supplyAsync(() -> request("tools/call", params), executor);
        try {
            return renderResult(name, future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolTimeoutException(name, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Tool call '" + name + "' interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) throw runtime;
            throw new ToolTransportException("Tool call '" + name + "' failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public synchronized void reconnect() {
        log.info("Reconnecting to MCP server [previousSession={}]", sessionId);
        sessionId = null;
        connected = false;
        initialize();
    }

    private void ensureConnected() {
        if (connected) return;
        synchronized (this) {
            if (!connected) initialize();
        }
    }

    private void initialize() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolVersion", properties.getMcp().getProtocolVersion());
        params.put("capabilities", Map.of());
        params.put("clientInfo", Map.of("name", properties.getMcp().getClientName(), "version", "0.1.0"));

        JsonNode result = request("initialize", params);
        notifyInitialized();
        connected = true;
        log.info("MCP session established [session={}, server={}, protocol={}]",
                sessionId, result.path("serverInfo").path("name").asText("unknown"),
                result.path("protocolVersion").asText());
    }

    private void notifyInitialized() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("method", "notifications/initialized");
        try {
            send(body);
        } catch (ToolTransportException e) {
            log.warn("initialized notification failed, continuing: {}", e.getMessage());
        }
    }

    private JsonNode request(String method, Map<String, Object> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", method);
        body.put("params", params);

        JsonNode response = parseBody(send(body));
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            String message = error.path("message").asText("unknown error");
            if (isSessionLost(message)) {
                markDisconnected();
                throw ToolTransportException.notConnected("MCP session invalid, client is not connected: " + message, null);
            }
            throw new AgentException("MCP " + method + " failed [" + error.path("code").asInt() + "]: " + message);
        }
        return response.path("result");
    }

    private String send(Map<String, Object> body) {
        try {
            ResponseEntity<String> entity = client().post()
                    .uri(properties.getMcp().getEndpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON, MediaType.TEXT_EVENT_STREAM)
                    .headers(h -> {
                        if (sessionId != null) h.set(SESSION_HEADER, sessionId);
                    })
                    .body(body)
                    .retrieve()
                    .toEntity(String.class);

            String returnedSession = entity.getHeaders().getFirst(SESSION_HEADER);
            if (returnedSession != null) {
                sessionId = returnedSession;
            }
            return entity.getBody() != null ? entity.getBody() : "";

        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == 404) {
                markDisconnected();
                throw ToolTransportException.notConnected("MCP session expired, client is not connected", e);
            }
            throw new ToolTransportException(
                    "MCP server error [" + e.getStatusCode().value() + "]: " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            markDisconnected();
            throw ToolTransportException.notConnected("MCP server unreachable, client is not connected: " + e.getMessage(), e);
        }
    }

    /** A JSON-RPC error that says the server no longer knows our session id. */
    static boolean isSessionLost(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("session") && SESSION_LOST_HINTS.stream().anyMatch(lower::contains);
    }

    /** Accepts a JSON body or an SSE body whose last data line holds the JSON-RPC message. */
    JsonNode parseBody(String body) {
        String json = body.strip();
        if (!json.startsWith("{")) {
            String last = null;
            for (String line : json.split("\r?\n")) {
                if (line.startsWith("data:")) last = line.substring(5).trim();
            }
            json = last != null ? last : "";
        }
        if (json.isEmpty()) {
            throw new ToolTransportException("MCP server returned an empty response");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ToolTransportException("Malformed MCP response: " + e.getOriginalMessage(), e);
        }
    }

    private String renderResult(String name, JsonNode result) {
        StringBuilder text = new StringBuilder();
        for (JsonNode item : result.path("content")) {
            if ("text".equals(item.path("type").asText()) && item.has("text")) {
                if (text.length() > 0) text.append('\n');
                text.append(item.get("text").asText());
            }
        }
        if (result.path("isError").asBoolean(false)) {
            log.warn("Tool [{}] reported an error: {}", name, text);
            return "ERROR: " + text;
        }
        return text.toString();
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return Map.of();
        return objectMapper.convertValue(node, new TypeReference<>() {});
    }

    private void markDisconnected() {
        sessionId = null;
        connected = false;
    }

    private RestClient client() {
        RestClient current = restClient;
        if (current == null) {
            String baseUrl = properties.getMcp().getBaseUrl();
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new AgentConfigurationException("tools.mcp.base-url is not set");
            }
            current = restClientBuilder.clone()
                    .baseUrl(baseUrl)
                    .defaultHeader(HttpHeaders.USER_AGENT, properties.getMcp().getClientName())
                    .build();
            restClient = current;
        }
        return current;
    }
}
