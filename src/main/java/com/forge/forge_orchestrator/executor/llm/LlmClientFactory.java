package com.forge.forge_orchestrator.executor.llm;

import com.forge.forge_orchestrator.exception.UnsupportedProviderException;
import com.forge.forge_orchestrator.model.domain.LlmProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class LlmClientFactory {

    private final Map<LlmProvider, LlmClient> clientMap = new EnumMap<>(LlmProvider.class);

    public LlmClientFactory(List<LlmClient> clients) {
        for (LlmClient client : clients) {
            clientMap.put(client.getProvider(), client);
        }
    }

    public LlmClient getClient(LlmProvider provider) {
        LlmClient client = clientMap.get(provider);
        if (client == null) {
            throw new UnsupportedProviderException(provider != null ? provider.getDisplayName() : "null");
        }
        return client;
    }
}
