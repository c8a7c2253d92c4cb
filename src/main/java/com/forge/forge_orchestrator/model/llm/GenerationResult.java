package com.forge.forge_orchestrator.model.llm;

public record GenerationResult(
    String text,
    int    inputTokens,
    int    outputTokens,
    double cost,
    String model
) {}
