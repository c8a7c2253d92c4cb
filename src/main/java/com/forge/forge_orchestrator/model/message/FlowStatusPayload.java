package com.forge.forge_orchestrator.model.message;

import com.forge.forge_orchestrator.model.status.FlowStatus;

import java.time.Instant;

/** Legacy FLOW_STATUS shape: empty strings rather than absent fields. */
public record FlowStatusPayload(
    long flowId,
    String status,
    String lastNode,
    Instant updatedAt,
    String error
) {
    public static FlowStatusPayload of(FlowStatus s) {
        return new FlowStatusPayload(
                s.flowId(),
                s.status().name(),
                s.lastNode() != null ? s.lastNode() : "",
                s.updatedAt(),
                s.error() != null ? s.error() : "");
    }
}
