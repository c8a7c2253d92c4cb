package com.forge.forge_orchestrator.model.status;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Latest known state of one flow run, as held by both signalers.
 * {@code lastNode} and {@code error} are left out of JSON when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowStatus(
    long flowId,
    FlowState status,
    String lastNode,
    Instant updatedAt,
    String error
) {
    public static FlowStatus running(long flowId) {
        return new FlowStatus(flowId, FlowState.RUNNING, null, Instant.now(), null);
    }

    public static FlowStatus runningAt(long flowId, String nodeId) {
        return new FlowStatus(flowId, FlowState.RUNNING, nodeId, Instant.now(), null);
    }

    public static FlowStatus completed(long flowId, String lastNode) {
        return new FlowStatus(flowId, FlowState.COMPLETED, lastNode, Instant.now(), null);
    }

    public static FlowStatus failed(long flowId, String lastNode, String error) {
        return new FlowStatus(flowId, FlowState.FAILED, lastNode, Instant.now(), error);
    }
}
