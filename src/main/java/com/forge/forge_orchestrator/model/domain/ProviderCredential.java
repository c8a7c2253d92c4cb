package com.forge.forge_orchestrator.model.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * API key for one provider, keyed by the provider name exactly as flows
 * reference it (e.g. "Anthropic").
 */
@Entity
@Table(name = "provider_credentials")
public class ProviderCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_name", nullable = false, unique = true)
    private String providerName;

    @Column(name = "api_key", nullable = false)
    private String apiKey;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() { this.updatedAt = Instant.now(); }

    public Long getId() { return id; }
    public String getProviderName() { return providerName; }
    public String getApiKey() { return apiKey; }
    public boolean isEnabled() { return enabled; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setId(Long id) { this.id = id; }
    public void setProviderName(String providerName) { this.providerName = providerName; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public void setCreatedAt(Instant t) { this.createdAt = t; }
    public void setUpdatedAt(Instant t) { this.updatedAt = t; }
}
