package com.forge.forge_orchestrator.model.message;

import java.time.Instant;

public record NodeStartedPayload(
    long flowId,
    String nodeId,
    String label,
    Instant timestamp
) implements FlowEventPayload {}
