package com.forge.forge_orchestrator.signal;

import com.forge.forge_orchestrator.model.status.FlowStatus;

/**
 * One channel through which a flow's latest status is published and read back.
 * The engine writes to both the durable and the live channel on every transition.
 */
public interface StatusSignaler {

    void notifyStatus(long flowId, FlowStatus status);

    /**
     * @throws com.forge.forge_orchestrator.exception.StatusNotFoundException if nothing was recorded for the flow
     */
    FlowStatus getStatus(long flowId);
}
