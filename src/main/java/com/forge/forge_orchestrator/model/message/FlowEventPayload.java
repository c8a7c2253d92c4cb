package com.forge.forge_orchestrator.model.message;

import java.time.Instant;

/** Fields every lifecycle payload carries. */
public interface FlowEventPayload {

    long flowId();

    Instant timestamp();
}
