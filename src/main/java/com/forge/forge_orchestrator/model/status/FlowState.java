package com.forge.forge_orchestrator.model.status;

public enum FlowState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
