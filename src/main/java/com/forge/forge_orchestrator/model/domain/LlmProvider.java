package com.forge.forge_orchestrator.model.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Providers an agent node may name. Each maps to a concrete LlmClient
 * and carries its list price in USD per million tokens.
 */
public enum LlmProvider {

    ANTHROPIC("Anthropic", "https://api.anthropic.com/v1/messages",           3.00, 15.00),
    OPENAI("OpenAI",       "https://api.openai.com/v1/chat/completions",       5.00, 15.00);

    private final String displayName;
    private final String defaultEndpoint;
    private final double inputUsdPerMillion;
    private final double outputUsdPerMillion;

    LlmProvider(String displayName, String defaultEndpoint, double inputUsdPerMillion, double outputUsdPerMillion) {
        this.displayName         = displayName;
        this.defaultEndpoint     = defaultEndpoint;
        this.inputUsdPerMillion  = inputUsdPerMillion;
        this.outputUsdPerMillion = outputUsdPerMillion;
    }

    public String getDisplayName()     { return displayName; }
    public String getDefaultEndpoint() { return defaultEndpoint; }

    public double cost(int inputTokens, int outputTokens) {
        return inputTokens * inputUsdPerMillion / 1_000_000d
                + outputTokens * outputUsdPerMillion / 1_000_000d;
    }

    /** Accepts the display name ("Anthropic") or the constant name, any case. */
    public static Optional<LlmProvider> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(p -> p.displayName.equalsIgnoreCase(trimmed) || p.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
