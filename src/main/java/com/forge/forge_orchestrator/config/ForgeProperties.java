package com.forge.forge_orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "forge")
public class ForgeProperties {

    private Status status = new Status();
    private Hub hub = new Hub();
    private Llm llm = new Llm();
    private Ledger ledger = new Ledger();

    /** Fallback API keys by provider name, e.g. forge.credentials.Anthropic=sk-... */
    private Map<String, String> credentials = new LinkedHashMap<>();

    @Data
    public static class Status {
        /** Directory holding one {flowId}.json file per flow. */
        private String directory = ".forge/status";
    }

    @Data
    public static class Hub {
        /** Per-observer outbound queue; messages beyond it are dropped for that observer. */
        private int queueCapacity = 256;
        private String endpoint = "/ws";
        private RedisRelay redisRelay = new RedisRelay();
    }

    @Data
    public static class RedisRelay {
        private boolean enabled = false;
        private String channel = "forge:hub:broadcast";
    }

    @Data
    public static class Llm {
        private Duration requestTimeout = Duration.ofSeconds(60);
        private int maxTokens = 4096;
    }

    @Data
    public static class Ledger {
        /** Entries returned by the ledger listing when no limit is given. */
        private int defaultLimit = 50;
        /** Daily spend ceiling in USD, reset at 00:00 UTC. */
        private double dailyBudget = 10.00;
        /** Estimated cost of one prompt, used for the remaining-prompts figure. */
        private double averagePromptCost = 0.01;
        /** Per-model overrides of averagePromptCost. */
        private Map<String, Double> promptCostByModel = new LinkedHashMap<>(Map.of("gpt-3.5-turbo", 0.002));
        /** Model the budget summary assumes when the caller names none. */
        private String defaultModel = "gpt-4o";
    }
}
