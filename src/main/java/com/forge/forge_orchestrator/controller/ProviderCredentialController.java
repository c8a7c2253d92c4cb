package com.forge.forge_orchestrator.controller;

import com.forge.forge_orchestrator.model.domain.LlmProvider;
import com.forge.forge_orchestrator.model.domain.ProviderCredential;
import com.forge.forge_orchestrator.service.CredentialService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Manages provider API keys. Keys are accepted in full but only ever returned masked. */
@RestController
@RequestMapping("/api/credentials")
public class ProviderCredentialController {

    private final CredentialService credentialService;

    public ProviderCredentialController(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @GetMapping
    public List<Map<String, Object>> listCredentials() {
        return credentialService.listCredentials().stream()
                .map(this::toView)
                .collect(Collectors.toList());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> saveCredential(@RequestBody Map<String, String> body) {
        ProviderCredential saved = credentialService.saveCredential(body.get("provider"), body.get("apiKey"));
        return ResponseEntity.ok(toView(saved));
    }

    @DeleteMapping("/{provider}")
    public ResponseEntity<Void> deleteCredential(@PathVariable String provider) {
        return credentialService.deleteCredential(provider)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private Map<String, Object> toView(ProviderCredential c) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("provider", c.getProviderName());
        entry.put("supported", LlmProvider.fromName(c.getProviderName()).isPresent());
        entry.put("enabled", c.isEnabled());
        entry.put("apiKeyMasked", maskKey(c.getApiKey()));
        entry.put("updatedAt", c.getUpdatedAt());
        return entry;
    }

    static String maskKey(String key) {
        if (key == null || key.length() < 10) return "****";
        return key.substring(0, 4) + "********" + key.substring(key.length() - 4);
    }
}
