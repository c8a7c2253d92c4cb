package com.forge.forge_orchestrator.executor.llm;

import com.forge.forge_orchestrator.config.ForgeProperties;
import com.forge.forge_orchestrator.exception.GenerationException;
import com.forge.forge_orchestrator.model.domain.LlmProvider;
import com.forge.forge_orchestrator.model.llm.GenerationResult;
import com.forge.forge_orchestrator.model.llm.LlmRequest;
import com.forge.forge_orchestrator.model.llm.LlmResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmGatewayTest {

    @Mock
    private LlmClient anthropic;
    @Mock
    private LlmClient openai;

    private LlmGateway gateway;

    @BeforeEach
    void setUp() {
        lenient().when(anthropic.getProvider()).thenReturn(LlmProvider.ANTHROPIC);
        lenient().when(openai.getProvider()).thenReturn(LlmProvider.OPENAI);
        gateway = new LlmGateway(new LlmClientFactory(List.of(anthropic, openai)), new ForgeProperties());
    }

    @Test
    void routesToProviderWithRolePromptAndPricesUsage() {
        when(anthropic.call(any(), eq("key"), isNull()))
                .thenReturn(LlmResponse.ok("Here you go: {\"steps\":[]}", "claude", 1_000_000, 1_000_000));

        GenerationResult result = gateway.execute("planner", "plan the thing", "key", LlmProvider.ANTHROPIC);

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(anthropic).call(request.capture(), eq("key"), isNull());
        assertThat(request.getValue().getSystemPrompt()).isEqualTo(AgentPrompts.systemPromptFor("Architect"));
        assertThat(request.getValue().getUserPrompt()).isEqualTo("plan the thing");
        assertThat(request.getValue().getMaxTokens()).isEqualTo(4096);

        assertThat(result.text()).isEqualTo("{\"steps\":[]}");
        assertThat(result.cost()).isCloseTo(18.0, within(1e-9));
        assertThat(result.model()).isEqualTo("claude");
        verify(openai, never()).call(any(), any(), any());
    }

    @Test
    void openAiPricing() {
        when(openai.call(any(), any(), any())).thenReturn(LlmResponse.ok("done", "gpt-4o", 200_000, 100_000));

        GenerationResult result = gateway.execute("coder", "x", "key", LlmProvider.OPENAI);

        assertThat(result.cost()).isCloseTo(1.0 + 1.5, within(1e-9));
    }

    @Test
    void fallsBackToScrapedTokenCountsWhenProviderReportsNone() {
        when(openai.call(any(), any(), any()))
                .thenReturn(LlmResponse.ok("\u001B[1mInput Tokens: 40 Output Tokens: 60\u001B[0m", "gpt-4o", 0, 0));

        GenerationResult result = gateway.execute("qa", "x", "key", LlmProvider.OPENAI);

        assertThat(result.inputTokens()).isEqualTo(40);
        assertThat(result.outputTokens()).isEqualTo(60);
        assertThat(result.text()).doesNotContain("\u001B");
    }

    @Test
    void providerErrorBecomesGenerationExceptionWithPartialUsage() {
        when(anthropic.call(any(), any(), any())).thenReturn(LlmResponse.error("Anthropic API error 529: overloaded", 30, 0));

        assertThatThrownBy(() -> gateway.execute("dev", "x", "key", LlmProvider.ANTHROPIC))
                .isInstanceOfSatisfying(GenerationException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Anthropic API error 529: overloaded");
                    assertThat(e.getInputTokens()).isEqualTo(30);
                    assertThat(e.getCost()).isCloseTo(30 * 3.0 / 1_000_000, within(1e-12));
                });
    }

    @Test
    void unknownRoleFailsWithoutCallingProvider() {
        assertThatThrownBy(() -> gateway.execute("poet", "x", "key", LlmProvider.ANTHROPIC))
                .isInstanceOf(GenerationException.class)
                .hasMessage("unknown agent role: poet");
        verify(anthropic, never()).call(any(), any(), any());
    }
}
