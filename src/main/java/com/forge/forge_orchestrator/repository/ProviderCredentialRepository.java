package com.forge.forge_orchestrator.repository;

import com.forge.forge_orchestrator.model.domain.ProviderCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProviderCredentialRepository extends JpaRepository<ProviderCredential, Long> {

    Optional<ProviderCredential> findByProviderNameIgnoreCase(String providerName);
}
