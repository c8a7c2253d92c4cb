package com.forge.forge_orchestrator.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forge.forge_orchestrator.exception.SignalDeliveryException;
import com.forge.forge_orchestrator.model.message.DecodedFlowMessage;
import com.forge.forge_orchestrator.model.message.FlowMessage;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON codec for the live message envelope. Encoding uses the application
 * ObjectMapper so timestamps come out as ISO-8601 strings.
 */
@Component
public class FlowMessageCodec {

    private final ObjectMapper objectMapper;

    public FlowMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(FlowMessage message) {
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new SignalDeliveryException("failed to encode " + message.type() + " message", e);
        }
    }

    /** Reads any envelope, including types this build does not know about. */
    public DecodedFlowMessage decode(byte[] bytes) {
        try {
            JsonNode root = objectMapper.readTree(bytes);
            if (root == null || !root.isObject() || !root.hasNonNull("type")) {
                throw new IllegalArgumentException("not a flow message envelope");
            }
            return new DecodedFlowMessage(root.get("type").asText(), root.path("payload"));
        } catch (IOException e) {
            throw new IllegalArgumentException("malformed flow message: " + e.getMessage(), e);
        }
    }
}
