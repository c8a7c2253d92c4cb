package com.forge.forge_orchestrator.executor.llm;

import com.forge.forge_orchestrator.config.ForgeProperties;
import com.forge.forge_orchestrator.exception.GenerationException;
import com.forge.forge_orchestrator.model.domain.LlmProvider;
import com.forge.forge_orchestrator.model.llm.GenerationResult;
import com.forge.forge_orchestrator.model.llm.LlmRequest;
import com.forge.forge_orchestrator.model.llm.LlmResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class LlmGateway implements GenerationService {

    private final LlmClientFactory clientFactory;
    private final int maxTokens;

    public LlmGateway(LlmClientFactory clientFactory, ForgeProperties properties) {
        this.clientFactory = clientFactory;
        this.maxTokens = properties.getLlm().getMaxTokens();
    }

    @Override
    public GenerationResult execute(String role, String prompt, String apiKey, LlmProvider provider) {
        String systemPrompt = AgentPrompts.systemPromptFor(role);
        LlmClient client = clientFactory.getClient(provider);

        LlmResponse resp = client.call(new LlmRequest(systemPrompt, prompt != null ? prompt : "", maxTokens), apiKey, null);
        if (!resp.isSuccess()) {
            int in = resp.getInputTokens();
            int out = resp.getOutputTokens();
            throw new GenerationException(resp.getErrorMessage(), in, out, provider.cost(in, out));
        }

        String text = LlmOutputParser.clean(resp.getRawText());
        int inputTokens = resp.getInputTokens();
        int outputTokens = resp.getOutputTokens();
        if (inputTokens == 0 && outputTokens == 0) {
            int[] scraped = LlmOutputParser.scrapeTokenCounts(text);
            inputTokens = scraped[0];
            outputTokens = scraped[1];
        }
        String content = LlmOutputParser.extractJson(text).orElse(text);

        double cost = provider.cost(inputTokens, outputTokens);
        log.debug("[{}] {} responded: {}in/{}out tokens, ${}",
                provider.getDisplayName(), resp.getModel(), inputTokens, outputTokens, cost);
        return new GenerationResult(content, inputTokens, outputTokens, cost, resp.getModel());
    }
}
