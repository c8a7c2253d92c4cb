package com.forge.forge_orchestrator.service;

import com.forge.forge_orchestrator.config.ForgeProperties;
import com.forge.forge_orchestrator.exception.MissingCredentialException;
import com.forge.forge_orchestrator.model.domain.ProviderCredential;
import com.forge.forge_orchestrator.repository.ProviderCredentialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialServiceTest {

    @Mock
    private ProviderCredentialRepository repository;

    private ForgeProperties properties;
    private CredentialService service;

    @BeforeEach
    void setUp() {
        properties = new ForgeProperties();
        service = new CredentialService(repository, properties);
        lenient().when(repository.findByProviderNameIgnoreCase(anyString())).thenReturn(Optional.empty());
    }

    private static ProviderCredential credential(String provider, String key, boolean enabled) {
        ProviderCredential c = new ProviderCredential();
        c.setProviderName(provider);
        c.setApiKey(key);
        c.setEnabled(enabled);
        return c;
    }

    @Test
    void storedCredentialWins() {
        properties.getCredentials().put("Anthropic", "from-config");
        when(repository.findByProviderNameIgnoreCase("Anthropic"))
                .thenReturn(Optional.of(credential("Anthropic", "from-db", true)));

        assertThat(service.requireApiKey("Anthropic")).isEqualTo("from-db");
    }

    @Test
    void disabledCredentialFallsBackToConfiguration() {
        properties.getCredentials().put("anthropic", "from-config");
        when(repository.findByProviderNameIgnoreCase("Anthropic"))
                .thenReturn(Optional.of(credential("Anthropic", "from-db", false)));

        assertThat(service.findApiKey("Anthropic")).contains("from-config");
    }

    @Test
    void missingKeyIsReportedByProviderName() {
        assertThatThrownBy(() -> service.requireApiKey("OpenAI"))
                .isInstanceOf(MissingCredentialException.class)
                .hasMessage("missing API key for provider OpenAI");
    }

    @Test
    void blankProviderHasNoKey() {
        assertThat(service.findApiKey(" ")).isEmpty();
        assertThat(service.findApiKey(null)).isEmpty();
    }

    @Test
    void saveUpsertsByProviderName() {
        ProviderCredential existing = credential("OpenAI", "old", false);
        when(repository.findByProviderNameIgnoreCase("OpenAI")).thenReturn(Optional.of(existing));
        when(repository.save(any(ProviderCredential.class))).thenAnswer(inv -> inv.getArgument(0));

        ProviderCredential saved = service.saveCredential(" OpenAI ", "sk-new");

        assertThat(saved).isSameAs(existing);
        assertThat(saved.getApiKey()).isEqualTo("sk-new");
        assertThat(saved.isEnabled()).isTrue();
    }

    @Test
    void saveRejectsMissingFields() {
        assertThatThrownBy(() -> service.saveCredential("OpenAI", "")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.saveCredential(null, "k")).isInstanceOf(IllegalArgumentException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void deleteReportsWhetherAnythingWasRemoved() {
        ProviderCredential existing = credential("OpenAI", "k", true);
        when(repository.findByProviderNameIgnoreCase("OpenAI")).thenReturn(Optional.of(existing));

        assertThat(service.deleteCredential("OpenAI")).isTrue();
        assertThat(service.deleteCredential("Google")).isFalse();
        verify(repository).delete(existing);
    }
}
