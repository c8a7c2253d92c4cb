package com.forge.forge_orchestrator.executor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forge.forge_orchestrator.config.ForgeProperties;
import com.forge.forge_orchestrator.model.llm.LlmRequest;
import com.forge.forge_orchestrator.model.llm.LlmResponse;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/** Runs both provider clients against a local HTTP stub. */
class LlmClientHttpTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String response = "{}";
    private boolean stopped;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String auth = exchange.getRequestHeaders().getFirst("x-api-key");
            lastAuth.set(auth != null ? auth : exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        if (!stopped) {
            server.stop(0);
        }
    }

    private String endpoint() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
    }

    private static LlmRequest request() {
        return new LlmRequest("system rules", "do the task", 256);
    }

    @Test
    void anthropicSendsSystemPromptAndReadsUsage() throws Exception {
        response = "{\"model\":\"claude-x\",\"content\":[{\"type\":\"text\",\"text\":\"hello\"}],"
                + "\"usage\":{\"input_tokens\":11,\"output_tokens\":7}}";

        LlmResponse resp = new AnthropicLlmClient(new ForgeProperties()).call(request(), "sk-ant", endpoint());

        assertThat(resp.isSuccess()).isTrue();
        assertThat(resp.getRawText()).isEqualTo("hello");
        assertThat(resp.getInputTokens()).isEqualTo(11);
        assertThat(resp.getOutputTokens()).isEqualTo(7);
        assertThat(resp.getModel()).isEqualTo("claude-x");
        assertThat(lastAuth.get()).isEqualTo("sk-ant");
        JsonNode sent = mapper.readTree(lastBody.get());
        assertThat(sent.get("system").asText()).isEqualTo("system rules");
        assertThat(sent.get("max_tokens").asInt()).isEqualTo(256);
        assertThat(sent.get("messages").get(0).get("content").asText()).isEqualTo("do the task");
    }

    @Test
    void anthropicErrorStatusIsReturnedAsFailure() {
        status = 401;
        response = "{\"error\":{\"type\":\"authentication_error\",\"message\":\"invalid x-api-key\"}}";

        LlmResponse resp = new AnthropicLlmClient(new ForgeProperties()).call(request(), "bad", endpoint());

        assertThat(resp.isSuccess()).isFalse();
        assertThat(resp.getErrorMessage()).isEqualTo("Anthropic API error 401: invalid x-api-key");
    }

    @Test
    void openAiSendsBearerTokenAndReadsUsage() throws Exception {
        response = "{\"model\":\"gpt-4o\",\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{}\"}}],"
                + "\"usage\":{\"prompt_tokens\":20,\"completion_tokens\":3}}";

        LlmResponse resp = new OpenAiLlmClient(new ForgeProperties()).call(request(), "sk-oa", endpoint());

        assertThat(resp.isSuccess()).isTrue();
        assertThat(resp.getRawText()).isEqualTo("{}");
        assertThat(resp.getInputTokens()).isEqualTo(20);
        assertThat(resp.getOutputTokens()).isEqualTo(3);
        assertThat(lastAuth.get()).isEqualTo("Bearer sk-oa");
        JsonNode sent = mapper.readTree(lastBody.get());
        assertThat(sent.get("messages").get(0).get("role").asText()).isEqualTo("system");
        assertThat(sent.get("messages").get(1).get("content").asText()).isEqualTo("do the task");
    }

    @Test
    void openAiResponseWithoutChoicesKeepsUsage() {
        response = "{\"choices\":[],\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":0}}";

        LlmResponse resp = new OpenAiLlmClient(new ForgeProperties()).call(request(), "sk-oa", endpoint());

        assertThat(resp.isSuccess()).isFalse();
        assertThat(resp.getInputTokens()).isEqualTo(5);
    }

    @Test
    void unreachableEndpointIsReturnedAsFailure() {
        String dead = endpoint();
        server.stop(0);
        stopped = true;

        LlmResponse resp = new OpenAiLlmClient(new ForgeProperties()).call(request(), "k", dead);

        assertThat(resp.isSuccess()).isFalse();
        assertThat(resp.getErrorMessage()).startsWith("OpenAI client exception");
    }
}
