package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.stream.ResponseSections;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * OpenAI-compatible chat client (Groq, OpenAI, Gemini, DashScope).
 *
 * Streaming responses are read line by line from the SSE body. Providers
 * that return a separate {@code reasoning_content} delta get it wrapped in
 * section markers: the thinking marker before the first reasoning delta and
 * the answer marker before the first content delta. Downstream code only
 * ever looks at the markers.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                        |
 * |------------------------|-----------------------------------------------|
 * | 401 invalid_api_key    | AgentException (not retried, not CB failure)  |
 * | 429 rate limit         | RuntimeException (retried)                    |
 * | 400 other              | AgentException (not retried, not CB failure)  |
 * | 5xx server error       | RuntimeException (retried, counts as failure) |
 * | network error          | ResourceAccessException (retried)             |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private static final String DATA_PREFIX = "data:";
    private static final String DONE = "[DONE]";

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public String complete(String prompt) {
        Map<String, Object> requestBody = buildRequestBody(List.of(Message.user(prompt)), false);

        log.debug("Sending completion to {} [model={}, promptChars={}]",
                providerName, props.getModel(), prompt.length());

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                    throw new RuntimeException(
                        providerName + " server error [" + res.getStatusCode() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        return parseCompletion(response);
    }

    @Override
    public String streamChat(List<Message> messages, Consumer<String> onDelta) {
        Map<String, Object> requestBody = buildRequestBody(messages, true);

        log.debug("Streaming {} messages to {} [model={}]",
                messages.size(), providerName, props.getModel());

        return restClient.post()
                .uri("/chat/completions")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .body(requestBody)
                .exchange((req, res) -> {
                    int status = res.getStatusCode().value();
                    if (res.getStatusCode().is4xxClientError() || res.getStatusCode().is5xxServerError()) {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} stream error [{}]: {}", providerName, status, body);
                        if (status >= 500) {
                            throw new RuntimeException(
                                providerName + " server error [" + status + "]: " + body);
                        }
                        handle4xxError(body, status);
                    }
                    return readStream(res.getBody(), onDelta);
                });
    }

    /**
     * Reads SSE frames until [DONE] or end of body. Returns the full text
     * including any section markers that were emitted.
     */
    String readStream(InputStream body, Consumer<String> onDelta) throws IOException {
        StreamState state = new StreamState(onDelta);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IOException("Stream interrupted");
                }
                if (!line.startsWith(DATA_PREFIX)) continue;
                String data = line.substring(DATA_PREFIX.length()).trim();
                if (data.isEmpty()) continue;
                if (DONE.equals(data)) break;

                JsonNode delta = objectMapper.readTree(data).path("choices").path(0).path("delta");
                state.reasoning(textOrNull(delta, "reasoning_content"));
                state.content(textOrNull(delta, "content"));
            }
        }
        return state.full.toString();
    }

    /**
     * Central 4xx error handler. Maps error codes to exception types so the
     * circuit breaker and retry behave correctly for each case.
     */
    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 401) {
            throw new AgentException(
                providerName + " API key is invalid. Check your " +
                providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }

        if (body.contains("model_decommissioned") || body.contains("model_not_found")) {
            throw new AgentException(
                "Model '" + props.getModel() + "' is not available on " + providerName +
                ". Update llm.providers." + providerName + ".model or the role override.");
        }

        throw new AgentException(providerName + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, boolean stream) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", messages.stream().map(this::formatMessage).toList());
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        // Observations are plain text turns here; a "tool" role without a
        // tool_call_id is rejected by OpenAI-compatible endpoints.
        Message.Role role = msg.getRole() == Message.Role.tool ? Message.Role.user : msg.getRole();
        m.put("role", role.name());
        m.put("content", msg.getContent() != null ? msg.getContent() : "");
        return m;
    }

    @SuppressWarnings("unchecked")
    private String parseCompletion(Map<String, Object> response) {
        if (response == null) {
            throw new AgentException(providerName + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new AgentException(providerName + " returned no choices in response");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage [prompt={}, completion={}]",
                    usage.get("prompt_tokens"), usage.get("completion_tokens"));
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        String content = message != null ? (String) message.get("content") : null;
        String reasoning = message != null ? (String) message.get("reasoning_content") : null;

        if (reasoning != null && !reasoning.isBlank()) {
            return ResponseSections.THINKING_MARKER + reasoning
                    + ResponseSections.ANSWER_MARKER + (content != null ? content : "");
        }
        return content != null ? content : "";
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /** Tracks which section marker has been written so far for one stream. */
    private static final class StreamState {
        private final Consumer<String> onDelta;
        private final StringBuilder full = new StringBuilder();
        private boolean inReasoning;
        private boolean inAnswer;

        StreamState(Consumer<String> onDelta) {
            this.onDelta = onDelta;
        }

        void reasoning(String text) {
            if (text == null || text.isEmpty()) return;
            if (!inReasoning) {
                inReasoning = true;
                write(ResponseSections.THINKING_MARKER);
            }
            write(text);
        }

        void content(String text) {
            if (text == null || text.isEmpty()) return;
            if (inReasoning && !inAnswer) {
                inAnswer = true;
                write(ResponseSections.ANSWER_MARKER);
            }
            write(text);
        }

        private void write(String text) {
            full.append(text);
            onDelta.accept(text);
        }
    }
}
