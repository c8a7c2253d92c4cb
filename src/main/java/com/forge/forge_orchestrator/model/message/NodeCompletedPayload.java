package com.forge.forge_orchestrator.model.message;

import java.time.Instant;

/** Sent for failed nodes too, so billed tokens are still reported. */
public record NodeCompletedPayload(
    long flowId,
    String nodeId,
    int inputTokens,
    int outputTokens,
    double cost,
    Instant timestamp
) implements FlowEventPayload {}
