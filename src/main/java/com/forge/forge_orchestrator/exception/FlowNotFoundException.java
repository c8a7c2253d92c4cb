package com.forge.forge_orchestrator.exception;

public class FlowNotFoundException extends NotFoundException {

    private final long flowId;

    public FlowNotFoundException(long flowId) {
        super("flow not found: " + flowId);
        this.flowId = flowId;
    }

    public long getFlowId() {
        return flowId;
    }
}
