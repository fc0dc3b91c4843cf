package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.exception.ToolTransportException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class McpToolTransportTest {

    private static final String URL = "http://mcp.test/mcp";

    private MockRestServiceServer server;
    private McpToolTransport transport;

    @BeforeEach
    void setUp() {
        ToolProperties properties = new ToolProperties();
        properties.getMcp().setBaseUrl("http://mcp.test");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        transport = new McpToolTransport(properties, new ObjectMapper(), builder, Runnable::run);
    }

    @Test
    void listTools_performsHandshakeAndSendsSessionId() {
        expectHandshake("s-1");
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.method").value("tools/list"))
                .andExpect(header("Mcp-Session-Id", "s-1"))
                .andRespond(withSuccess("""
                        {"jsonrpc":"2.0","id":2,"result":{"tools":[
                          {"name":"search_documents","description":"Search","inputSchema":{"type":"object"}},
                          {"name":"conclude_document_chunks"}]}}
                        """, MediaType.APPLICATION_JSON));

        List<ToolDefinition> tools = transport.listTools();

        assertThat(tools).extracting(ToolDefinition::getName)
                .containsExactly("search_documents", "conclude_document_chunks");
        assertThat(tools.get(0).getInputSchema()).containsEntry("type", "object");
        server.verify();
    }

    @Test
    void callTool_joinsTextContent() {
        expectHandshake("s-1");
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.method").value("tools/call"))
                .andExpect(jsonPath("$.params.name").value("search_documents"))
                .andExpect(jsonPath("$.params.arguments.query").value("pump"))
                .andRespond(withSuccess("""
                        {"jsonrpc":"2.0","id":2,"result":{"content":[
                          {"type":"text","text":"first"},
                          {"type":"image","data":"..."},
                          {"type":"text","text":"second"}]}}
                        """, MediaType.APPLICATION_JSON));

        String result = transport.callTool("search_documents", Map.of("query", "pump"), Duration.ofSeconds(5));

        assertThat(result).isEqualTo("first\nsecond");
    }

    @Test
    void callTool_toolError_isPrefixed() {
        expectHandshake("s-1");
        server.expect(requestTo(URL))
                .andRespond(withSuccess("""
                        {"jsonrpc":"2.0","id":2,"result":{"isError":true,"content":[{"type":"text","text":"bad args"}]}}
                        """, MediaType.APPLICATION_JSON));

        assertThat(transport.callTool("search_documents", Map.of(), Duration.ofSeconds(5)))
                .isEqualTo("ERROR: bad args");
    }

    @Test
    void callTool_expiredSession_raisesNotConnected() {
        expectHandshake("s-1");
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> transport.callTool("search_documents", Map.of(), Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(ToolTransportException.class,
                        e -> assertThat(e.isNotConnected()).isTrue());
    }

    @Test
    void callTool_unknownSessionError_raisesNotConnected() {
        expectHandshake("s-1");
        server.expect(requestTo(URL))
                .andRespond(withSuccess("""
                        {"jsonrpc":"2.0","id":2,"error":{"code":-32001,"message":"Session not found"}}
                        """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> transport.callTool("search_documents", Map.of(), Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(ToolTransportException.class,
                        e -> assertThat(e.isNotConnected()).isTrue());
    }

    @Test
    void callTool_errorThatOnlyMentionsSession_isNotTreatedAsDisconnect() {
        expectHandshake("s-1");
        server.expect(requestTo(URL))
                .andRespond(withSuccess("""
                        {"jsonrpc":"2.0","id":2,"error":{"code":-32000,"message":"Session limit reached for tenant"}}
                        """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> transport.callTool("search_documents", Map.of(), Duration.ofSeconds(5)))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("Session limit reached");
    }

    @Test
    void isSessionLost_needsSessionAndALossHint() {
        assertThat(McpToolTransport.isSessionLost("Invalid session ID")).isTrue();
        assertThat(McpToolTransport.isSessionLost("SESSION EXPIRED")).isTrue();
        assertThat(McpToolTransport.isSessionLost("session limit reached")).isFalse();
        assertThat(McpToolTransport.isSessionLost("invalid params")).isFalse();
    }

    @Test
    void reconnect_replacesSession() {
        expectHandshake("s-1");
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));
        expectHandshake("s-2");
        server.expect(requestTo(URL))
                .andExpect(header("Mcp-Session-Id", "s-2"))
                .andRespond(withSuccess("""
                        {"jsonrpc":"2.0","id":5,"result":{"content":[{"type":"text","text":"ok"}]}}
                        """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> transport.callTool("t", Map.of(), Duration.ofSeconds(5)))
                .isInstanceOf(ToolTransportException.class);
        transport.reconnect();

        assertThat(transport.callTool("t", Map.of(), Duration.ofSeconds(5))).isEqualTo("ok");
        server.verify();
    }

    @Test
    void parseBody_acceptsSseFrame() {
        String body = "event: message\ndata: {\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"ok\":true}}\n\n";

        assertThat(transport.parseBody(body).path("result").path("ok").asBoolean()).isTrue();
    }

    @Test
    void parseBody_empty_throws() {
        assertThatThrownBy(() -> transport.parseBody("event: ping\n"))
                .isInstanceOf(ToolTransportException.class);
    }

    private void expectHandshake(String sessionId) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("Mcp-Session-Id", sessionId);
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.method").value("initialize"))
                .andExpect(jsonPath("$.params.protocolVersion").value("2024-11-05"))
                .andRespond(withSuccess("""
                        {"jsonrpc":"2.0","id":1,"result":{"protocolVersion":"2024-11-05","serverInfo":{"name":"docs"}}}
                        """, MediaType.APPLICATION_JSON).headers(headers));
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.method").value("notifications/initialized"))
                .andRespond(withStatus(HttpStatus.ACCEPTED));
    }
}
