package com.forge.forge_orchestrator.model.message;

import com.forge.forge_orchestrator.model.status.FlowStatus;

import java.time.Instant;

/**
 * Wire envelope for live events: exactly {@code {"type": ..., "payload": {...}}}.
 * Each factory stamps the current time once; instances are never changed afterwards.
 */
public record FlowMessage(MessageType type, Object payload) {

    public static FlowMessage flowStarted(long flowId) {
        return new FlowMessage(MessageType.FLOW_STARTED, new FlowStartedPayload(flowId, Instant.now()));
    }

    public static FlowMessage nodeStarted(long flowId, String nodeId, String label) {
        return new FlowMessage(MessageType.NODE_STARTED,
                new NodeStartedPayload(flowId, nodeId, label, Instant.now()));
    }

    public static FlowMessage nodeCompleted(long flowId, String nodeId, int inputTokens, int outputTokens, double cost) {
        return new FlowMessage(MessageType.NODE_COMPLETED,
                new NodeCompletedPayload(flowId, nodeId, inputTokens, outputTokens, cost, Instant.now()));
    }

    public static FlowMessage flowCompleted(long flowId, long executionTimeMs) {
        return new FlowMessage(MessageType.FLOW_COMPLETED,
                new FlowCompletedPayload(flowId, Instant.now(), executionTimeMs));
    }

    public static FlowMessage flowFailed(long flowId, String error) {
        return new FlowMessage(MessageType.FLOW_FAILED, new FlowFailedPayload(flowId, Instant.now(), error));
    }

    public static FlowMessage flowStatus(FlowStatus status) {
        return new FlowMessage(MessageType.FLOW_STATUS, FlowStatusPayload.of(status));
    }
}
