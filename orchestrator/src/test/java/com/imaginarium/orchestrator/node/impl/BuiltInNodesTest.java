package com.imaginarium.orchestrator.node.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imaginarium.orchestrator.node.CancellationToken;
import com.imaginarium.orchestrator.node.ErrorClassification;
import com.imaginarium.orchestrator.node.NodeExecutionContext;
import com.imaginarium.orchestrator.node.NodeExecutionException;
import com.imaginarium.orchestrator.node.NodeResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuiltInNodesTest {

    private static final NodeExecutionContext CTX = new NodeExecutionContext(
            UUID.randomUUID(), UUID.randomUUID(), "node", 1, new CancellationToken());

    // ------------------------------------------------------------------
    // text-input / template / output
    // ------------------------------------------------------------------

    @Test
    void textInput_emitsConfiguredText() {
        NodeResult result = new TextInputNode().execute(Map.of("text", "hello"), Map.of(), CTX);

        assertThat(result.outputs()).containsExactly(Map.entry("text", "hello"));
    }

    @Test
    void textInput_blankText_isPermanent() {
        assertThatThrownBy(() -> new TextInputNode().execute(Map.of("text", "  "), Map.of(), CTX))
                .isInstanceOfSatisfying(NodeExecutionException.class, e -> {
                    assertThat(e.getClassification()).isEqualTo(ErrorClassification.PERMANENT);
                    assertThat(e.getCode()).isEqualTo("INVALID_CONFIG");
                });
    }

    @Test
    void template_substitutesInputs() {
        NodeResult result = new TemplateNode().execute(
                Map.of("template", "Summarize {{ doc }} for {{audience}}."),
                Map.of("doc", "the report", "audience", "$managers"), CTX);

        assertThat(result.outputs().get("text")).isEqualTo("Summarize the report for $managers.");
    }

    @Test
    void template_missingInput_strictFailsLenientBlanks() {
        TemplateNode node = new TemplateNode();

        assertThatThrownBy(() -> node.execute(Map.of("template", "Hi {{name}}"), Map.of(), CTX))
                .isInstanceOfSatisfying(NodeExecutionException.class,
                        e -> assertThat(e.getCode()).isEqualTo("MISSING_INPUT"));

        NodeResult lenient = node.execute(Map.of("template", "Hi {{name}}", "strict", false), Map.of(), CTX);
        assertThat(lenient.outputs().get("text")).isEqualTo("Hi ");
    }

    @Test
    @SuppressWarnings("unchecked")
    void output_collectsInputsAndLabel() {
        NodeResult result = new OutputNode().execute(Map.of("label", "final"), Map.of("summary", "ok"), CTX);

        Map<String, Object> collected = (Map<String, Object>) result.outputs().get("result");
        assertThat(collected).containsEntry("summary", "ok").containsEntry("label", "final");
    }

    // ------------------------------------------------------------------
    // http-request
    // ------------------------------------------------------------------

    @Test
    void httpStatus_classification() {
        assertThat(HttpRequestNode.classifyStatus(200)).isNull();
        assertThat(HttpRequestNode.classifyStatus(204)).isNull();
        assertThat(HttpRequestNode.classifyStatus(429)).isEqualTo(ErrorClassification.TRANSIENT);
        assertThat(HttpRequestNode.classifyStatus(503)).isEqualTo(ErrorClassification.TRANSIENT);
        assertThat(HttpRequestNode.classifyStatus(400)).isEqualTo(ErrorClassification.PERMANENT);
        assertThat(HttpRequestNode.classifyStatus(404)).isEqualTo(ErrorClassification.PERMANENT);
    }

    @Nested
    class AgainstLocalServer {

        HttpServer server;
        String     baseUrl;
        boolean    stopped;
        final AtomicReference<String> lastBody   = new AtomicReference<>();
        final AtomicReference<String> lastMethod = new AtomicReference<>();

        final HttpRequestNode node = new HttpRequestNode(new ObjectMapper());

        @BeforeEach
        void start() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/ok", exchange -> {
                lastMethod.set(exchange.getRequestMethod());
                lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                exchange.getResponseHeaders().add(HttpRequestNode.COST_HEADER, "0.0042");
                exchange.getResponseHeaders().add(HttpRequestNode.TOKENS_HEADER, "128");
                respond(exchange, 200, "{\"answer\":\"42\"}");
            });
            server.createContext("/busy", exchange -> respond(exchange, 503, "try later"));
            server.createContext("/bad", exchange -> respond(exchange, 422, "no"));
            server.start();
            baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        }

        @AfterEach
        void stop() {
            if (!stopped) server.stop(0);
        }

        @Test
        void post_sendsInputsAsJsonAndReportsUsage() {
            NodeResult result = node.execute(Map.of("url", baseUrl + "/ok"), Map.of("prompt", "hi"), CTX);

            assertThat(lastMethod.get()).isEqualTo("POST");
            assertThat(lastBody.get()).isEqualTo("{\"prompt\":\"hi\"}");
            assertThat(result.outputs()).containsEntry("status", 200)
                    .containsEntry("body", Map.of("answer", "42"));
            assertThat(result.cost()).isEqualByComparingTo("0.0042");
            assertThat(result.tokensUsed()).isEqualTo(128);
        }

        @Test
        void get_sendsNoBody() {
            node.execute(Map.of("url", baseUrl + "/ok", "method", "get"), Map.of("ignored", 1), CTX);

            assertThat(lastMethod.get()).isEqualTo("GET");
            assertThat(lastBody.get()).isEmpty();
        }

        @Test
        void serverError_isTransient() {
            assertThatThrownBy(() -> node.execute(Map.of("url", baseUrl + "/busy"), Map.of(), CTX))
                    .isInstanceOfSatisfying(NodeExecutionException.class, e -> {
                        assertThat(e.isTransient()).isTrue();
                        assertThat(e.getCode()).isEqualTo("HTTP_503");
                    });
        }

        @Test
        void clientError_isPermanent() {
            assertThatThrownBy(() -> node.execute(Map.of("url", baseUrl + "/bad"), Map.of(), CTX))
                    .isInstanceOfSatisfying(NodeExecutionException.class, e -> {
                        assertThat(e.isTransient()).isFalse();
                        assertThat(e.getCode()).isEqualTo("HTTP_422");
                    });
        }

        @Test
        void connectionRefused_isTransient() {
            int port = server.getAddress().getPort();
            server.stop(0);
            stopped = true;

            assertThatThrownBy(() -> node.execute(Map.of("url", "http://127.0.0.1:" + port + "/ok"), Map.of(), CTX))
                    .isInstanceOfSatisfying(NodeExecutionException.class,
                            e -> assertThat(e.getCode()).isEqualTo("IO_ERROR"));
        }

        @Test
        void unsupportedMethod_isPermanent() {
            assertThatThrownBy(() -> node.execute(Map.of("url", baseUrl + "/ok", "method", "PATCH"), Map.of(), CTX))
                    .isInstanceOfSatisfying(NodeExecutionException.class,
                            e -> assertThat(e.getCode()).isEqualTo("INVALID_CONFIG"));
        }
    }

    private static void respond(HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
