package com.forge.forge_orchestrator.model.message;

import java.time.Instant;

public record FlowCompletedPayload(
    long flowId,
    Instant timestamp,
    long executionTimeMs
) implements FlowEventPayload {}
