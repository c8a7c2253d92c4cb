package com.forge.forge_orchestrator.model.message;

import java.time.Instant;

public record FlowStartedPayload(long flowId, Instant timestamp) implements FlowEventPayload {}
