package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.exception.AgentException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.deepansh.orchestrator.stream.ResponseSections.ANSWER_MARKER;
import static com.deepansh.orchestrator.stream.ResponseSections.THINKING_MARKER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GenericLlmClientTest {

    private MockRestServiceServer server;
    private GenericLlmClient client;

    @BeforeEach
    void setUp() {
        LlmProviderProperties props = new LlmProviderProperties();
        props.setBaseUrl("http://llm.test/v1");
        props.setModel("test-model");
        props.setApiKey("key");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GenericLlmClient(props, new ObjectMapper(), "groq", builder);
    }

    @Test
    void readStream_reasoningThenContent_insertsSectionMarkers() throws Exception {
        List<String> deltas = new ArrayList<>();
        String body = String.join("\n",
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"think \"}}]}",
                "",
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"more\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"content\":\"Answer: \"}}]}",
                "data: {\"choices\":[{\"delta\":{\"content\":\"42\"}}]}",
                "data: [DONE]",
                "data: {\"choices\":[{\"delta\":{\"content\":\"ignored\"}}]}");

        String full = client.readStream(stream(body), deltas::add);

        assertThat(full).isEqualTo(THINKING_MARKER + "think more" + ANSWER_MARKER + "Answer: 42");
        assertThat(String.join("", deltas)).isEqualTo(full);
    }

    @Test
    void readStream_contentOnly_hasNoMarkers() throws Exception {
        String body = "data: {\"choices\":[{\"delta\":{\"content\":\"plain\"}}]}\n"
                + ": keep-alive\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":null}}]}\n";

        assertThat(client.readStream(stream(body), d -> { })).isEqualTo("plain");
    }

    @Test
    void complete_reasoningContent_isWrappedInMarkers() {
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("""
                        {"choices": [{"message": {"content": "RELEVANT", "reasoning_content": "it mentions pumps"}}]}
                        """, MediaType.APPLICATION_JSON));

        String result = client.complete("judge this");

        assertThat(result).isEqualTo(THINKING_MARKER + "it mentions pumps" + ANSWER_MARKER + "RELEVANT");
        server.verify();
    }

    @Test
    void complete_invalidApiKey_throwsAgentException() {
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\": {\"code\": \"invalid_api_key\"}}"));

        assertThatThrownBy(() -> client.complete("hi"))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("API key is invalid");
    }

    private static ByteArrayInputStream stream(String body) {
        return new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8));
    }
}
