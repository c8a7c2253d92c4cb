package com.forge.forge_orchestrator.service;

import com.forge.forge_orchestrator.config.ForgeProperties;
import com.forge.forge_orchestrator.exception.MissingCredentialException;
import com.forge.forge_orchestrator.model.domain.ProviderCredential;
import com.forge.forge_orchestrator.repository.ProviderCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * API keys by provider name. Stored credentials win; {@code forge.credentials.*}
 * properties are the fallback. Keys are never logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialService {

    private final ProviderCredentialRepository repository;
    private final ForgeProperties properties;

    public Optional<String> findApiKey(String providerName) {
        if (providerName == null || providerName.isBlank()) {
            return Optional.empty();
        }
        String name = providerName.trim();
        Optional<String> stored = repository.findByProviderNameIgnoreCase(name)
                .filter(ProviderCredential::isEnabled)
                .map(ProviderCredential::getApiKey)
                .filter(key -> !key.isBlank());
        if (stored.isPresent()) {
            return stored;
        }
        return properties.getCredentials().entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .filter(key -> key != null && !key.isBlank())
                .findFirst();
    }

    public String requireApiKey(String providerName) {
        return findApiKey(providerName).orElseThrow(() -> new MissingCredentialException(providerName));
    }

    public List<ProviderCredential> listCredentials() {
        return repository.findAll();
    }

    @Transactional
    public ProviderCredential saveCredential(String providerName, String apiKey) {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("provider is required");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey is required");
        }
        String name = providerName.trim();
        ProviderCredential credential = repository.findByProviderNameIgnoreCase(name)
                .orElseGet(ProviderCredential::new);
        credential.setProviderName(name);
        credential.setApiKey(apiKey.trim());
        credential.setEnabled(true);
        ProviderCredential saved = repository.save(credential);
        log.info("Stored API key for provider {}", name);
        return saved;
    }

    /** @return false when nothing was stored for the provider */
    @Transactional
    public boolean deleteCredential(String providerName) {
        Optional<ProviderCredential> existing = repository.findByProviderNameIgnoreCase(providerName);
        existing.ifPresent(c -> {
            repository.delete(c);
            log.info("Removed API key for provider {}", c.getProviderName());
        });
        return existing.isPresent();
    }
}
