package com.forge.forge_orchestrator.model.message;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * A message as an observer reads it. The type stays a plain string so kinds
 * added later still decode.
 */
public record DecodedFlowMessage(String type, JsonNode payload) {

    public Optional<MessageType> knownType() {
        return MessageType.fromWire(type);
    }

    public long flowId() {
        return payload != null ? payload.path("flowId").asLong(-1) : -1;
    }
}
