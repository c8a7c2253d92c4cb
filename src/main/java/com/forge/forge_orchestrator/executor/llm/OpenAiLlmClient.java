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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Chat-completions client; works against any OpenAI-compatible endpoint. */
@Slf4j
@Component
public class OpenAiLlmClient implements LlmClient {

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final ObjectMapper mapper = new ObjectMapper();
    private final Duration requestTimeout;

    public OpenAiLlmClient(ForgeProperties properties) {
        this.requestTimeout = properties.getLlm().getRequestTimeout();
    }

    @Override
    public LlmProvider getProvider() { return LlmProvider.OPENAI; }

    @Override
    public String getDefaultModel() { return "gpt-4o"; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : getProvider().getDefaultEndpoint();
        String model = getDefaultModel();
        try {
            List<Map<String, String>> messages = new ArrayList<>();
            if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
                messages.add(Map.of("role", "system", "content", req.getSystemPrompt()));
            }
            messages.add(Map.of("role", "user", "content", req.getUserPrompt()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("messages", messages);
            body.put("max_tokens", req.getMaxTokens());
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[OpenAI] HTTP {}", httpResp.statusCode());
                return LlmResponse.error("OpenAI API error " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
            }
            JsonNode resp = mapper.readTree(httpResp.body());
            JsonNode usage = resp.path("usage");
            int inputTokens = usage.path("prompt_tokens").asInt(0);
            int outputTokens = usage.path("completion_tokens").asInt(0);
            JsonNode choices = resp.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                return LlmResponse.error("OpenAI returned no choices", inputTokens, outputTokens);
            }
            String text = choices.get(0).path("message").path("content").asText("");
            return LlmResponse.ok(text, resp.path("model").asText(model), inputTokens, outputTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error("OpenAI call interrupted");
        } catch (IOException | RuntimeException e) {
            log.error("[OpenAI] Exception calling API: {}", e.getMessage());
            return LlmResponse.error("OpenAI client exception: " + e.getMessage());
        }
    }

    private String extractError(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("error").path("message");
            if (msg.isTextual()) {
                return msg.asText();
            }
        } catch (IOException e) {
            log.debug("[OpenAI] Error body is not JSON: {}", e.getMessage());
        }
        return AnthropicLlmClient.fallbackBody(body);
    }
}
