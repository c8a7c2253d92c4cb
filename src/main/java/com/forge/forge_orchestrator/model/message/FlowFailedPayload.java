package com.forge.forge_orchestrator.model.message;

import java.time.Instant;

public record FlowFailedPayload(
    long flowId,
    Instant timestamp,
    String error
) implements FlowEventPayload {}
