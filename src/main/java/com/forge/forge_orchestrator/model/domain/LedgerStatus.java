package com.forge.forge_orchestrator.model.domain;

public enum LedgerStatus {
    SUCCESS,
    FAILED
}
