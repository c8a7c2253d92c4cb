package com.forge.forge_orchestrator.model.message;

import java.util.Arrays;
import java.util.Optional;

public enum MessageType {
    FLOW_STARTED,
    NODE_STARTED,
    NODE_COMPLETED,
    FLOW_COMPLETED,
    FLOW_FAILED,
    // Emitted by the live signaler on every status change; kept for older UIs
    FLOW_STATUS;

    public static Optional<MessageType> fromWire(String type) {
        return Arrays.stream(values()).filter(t -> t.name().equals(type)).findFirst();
    }
}
