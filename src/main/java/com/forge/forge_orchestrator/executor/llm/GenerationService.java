package com.forge.forge_orchestrator.executor.llm;

import com.forge.forge_orchestrator.model.domain.LlmProvider;
import com.forge.forge_orchestrator.model.llm.GenerationResult;

/** Runs one role + prompt against a provider. */
public interface GenerationService {

    /**
     * @throws com.forge.forge_orchestrator.exception.GenerationException on any failure,
     *         carrying whatever usage the provider reported
     */
    GenerationResult execute(String role, String prompt, String apiKey, LlmProvider provider);
}
