package com.forge.forge_orchestrator.executor.llm;

import com.forge.forge_orchestrator.model.domain.LlmProvider;
import com.forge.forge_orchestrator.model.llm.LlmRequest;
import com.forge.forge_orchestrator.model.llm.LlmResponse;

public interface LlmClient {

    LlmProvider getProvider();

    /**
     * Sends one request. Transport and API failures come back as
     * {@link LlmResponse#error}, never as exceptions.
     *
     * @param endpoint override URL, or null for the provider's default
     */
    LlmResponse call(LlmRequest request, String apiKey, String endpoint);

    String getDefaultModel();
}
