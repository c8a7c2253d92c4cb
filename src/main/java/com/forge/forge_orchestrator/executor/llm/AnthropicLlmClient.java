package com.forge.forge_orchestrator.executor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forge.forge_orchestrator.config.ForgeProperties;
import com.forge.forge_orchestrator.model.domain.LlmProvider;
import com.forge.forge_orchestrator.model.llm.LlmRequest;
import com.forge.forge_orchestrator.model.llm.LlmResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class AnthropicLlmClient implements LlmClient {

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final ObjectMapper mapper = new ObjectMapper();
    private final Duration requestTimeout;

    public AnthropicLlmClient(ForgeProperties properties) {
        this.requestTimeout = properties.getLlm().getRequestTimeout();
    }

    @Override
    public LlmProvider getProvider() { return LlmProvider.ANTHROPIC; }

    @Override
    public String getDefaultModel() { return "claude-3-5-sonnet-20240620"; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : getProvider().getDefaultEndpoint();
        String model = getDefaultModel();
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("max_tokens", req.getMaxTokens());
            body.put("messages", List.of(Map.of("role", "user", "content", req.getUserPrompt())));
            if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
                body.put("system", req.getSystemPrompt());
            }
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", ANTHROPIC_VERSION)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[Anthropic] HTTP {}", httpResp.statusCode());
                return LlmResponse.error("Anthropic API error " + httpResp.statusCode() + ": " + extractErrorMessage(httpResp.body()));
            }
            JsonNode resp = mapper.readTree(httpResp.body());
            JsonNode usage = resp.path("usage");
            int inputTokens = usage.path("input_tokens").asInt(0);
            int outputTokens = usage.path("output_tokens").asInt(0);
            JsonNode content = resp.path("content");
            if (!content.isArray() || content.isEmpty()) {
                return LlmResponse.error("Anthropic returned no content", inputTokens, outputTokens);
            }
            String text = content.get(0).path("text").asText("");
            return LlmResponse.ok(text, resp.path("model").asText(model), inputTokens, outputTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error("Anthropic call interrupted");
        } catch (IOException | RuntimeException e) {
            log.error("[Anthropic] Exception calling API: {}", e.getMessage());
            return LlmResponse.error("Anthropic client exception: " + e.getMessage());
        }
    }

    private String extractErrorMessage(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("error").path("message");
            if (msg.isTextual()) {
                return msg.asText();
            }
        } catch (IOException e) {
            log.debug("[Anthropic] Error body is not JSON: {}", e.getMessage());
        }
        return fallbackBody(body);
    }

    static String fallbackBody(String body) {
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}
