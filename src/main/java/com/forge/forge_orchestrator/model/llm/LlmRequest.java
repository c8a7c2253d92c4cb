package com.forge.forge_orchestrator.model.llm;

/**
 * Provider-agnostic request that LlmGateway builds.
 * Each LlmClient implementation translates this into its provider's API format
 * and sends it to the provider's default model.
 */
public class LlmRequest {

    private final String systemPrompt;
    private final String userPrompt;
    private final int maxTokens;

    public LlmRequest(String systemPrompt, String userPrompt, int maxTokens) {
        this.systemPrompt = systemPrompt;
        this.userPrompt = userPrompt;
        this.maxTokens = maxTokens;
    }

    public String getSystemPrompt() { return systemPrompt; }
    public String getUserPrompt() { return userPrompt; }
    public int getMaxTokens() { return maxTokens; }
}
