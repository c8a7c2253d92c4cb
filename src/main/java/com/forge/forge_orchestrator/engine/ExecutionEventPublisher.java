package com.forge.forge_orchestrator.engine;

import com.forge.forge_orchestrator.hub.Broadcaster;
import com.forge.forge_orchestrator.model.message.FlowMessage;
import com.forge.forge_orchestrator.model.status.FlowStatus;
import com.forge.forge_orchestrator.signal.FileStatusSignaler;
import com.forge.forge_orchestrator.signal.LiveStatusSignaler;
import com.forge.forge_orchestrator.signal.StatusSignaler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Emits lifecycle messages to the hub and status transitions to both signalers.
 * Nothing here ever fails a run: delivery problems are logged and dropped.
 */
@Slf4j
@Component
public class ExecutionEventPublisher {

    private final Broadcaster broadcaster;
    private final FlowMessageCodec codec;
    private final StatusSignaler durable;
    private final StatusSignaler live;

    @Autowired
    public ExecutionEventPublisher(Broadcaster broadcaster,
                                   FlowMessageCodec codec,
                                   FileStatusSignaler durable,
                                   LiveStatusSignaler live) {
        this(broadcaster, codec, (StatusSignaler) durable, (StatusSignaler) live);
    }

    ExecutionEventPublisher(Broadcaster broadcaster,
                            FlowMessageCodec codec,
                            StatusSignaler durable,
                            StatusSignaler live) {
        this.broadcaster = broadcaster;
        this.codec = codec;
        this.durable = durable;
        this.live = live;
    }

    public void flowStarted(long flowId) {
        publish(FlowMessage.flowStarted(flowId));
        signal(flowId, FlowStatus.running(flowId));
    }

    public void nodeStarted(long flowId, String nodeId, String label) {
        publish(FlowMessage.nodeStarted(flowId, nodeId, label));
        signal(flowId, FlowStatus.runningAt(flowId, nodeId));
    }

    public void nodeCompleted(long flowId, String nodeId, int inputTokens, int outputTokens, double cost) {
        publish(FlowMessage.nodeCompleted(flowId, nodeId, inputTokens, outputTokens, cost));
    }

    public void flowCompleted(long flowId, String lastNode, long executionTimeMs) {
        publish(FlowMessage.flowCompleted(flowId, executionTimeMs));
        signal(flowId, FlowStatus.completed(flowId, lastNode));
    }

    public void flowFailed(long flowId, String lastNode, String error) {
        publish(FlowMessage.flowFailed(flowId, error));
        signal(flowId, FlowStatus.failed(flowId, lastNode, error));
    }

    private void publish(FlowMessage message) {
        try {
            broadcaster.broadcast(codec.encode(message));
        } catch (RuntimeException e) {
            log.warn("Broadcast of {} failed: {}", message.type(), e.getMessage());
        }
    }

    // Durable first so a client that reconnects after a live push can always read it back.
    private void signal(long flowId, FlowStatus status) {
        try {
            durable.notifyStatus(flowId, status);
        } catch (RuntimeException e) {
            log.warn("Durable status {} for flow {} not written: {}", status.status(), flowId, e.getMessage());
        }
        try {
            live.notifyStatus(flowId, status);
        } catch (RuntimeException e) {
            log.warn("Live status {} for flow {} not delivered: {}", status.status(), flowId, e.getMessage());
        }
    }
}
