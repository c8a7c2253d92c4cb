package com.forge.forge_orchestrator.model.domain;

/** Editorial state of a stored flow. Run state lives in {@code FlowStatus}. */
public enum FlowDefinitionStatus {
    DRAFT,
    ACTIVE,
    ARCHIVED
}
