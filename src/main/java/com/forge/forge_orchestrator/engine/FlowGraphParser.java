package com.forge.forge_orchestrator.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forge.forge_orchestrator.exception.FlowParseException;
import com.forge.forge_orchestrator.model.graph.FlowGraph;
import org.springframework.stereotype.Component;

@Component
public class FlowGraphParser {

    private final ObjectMapper objectMapper;

    public FlowGraphParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the stored {@code {"nodes": [...], "edges": [...]}} document.
     * Missing arrays come back empty; anything that is not a JSON object fails.
     */
    public FlowGraph parse(String rawGraphJson) {
        if (rawGraphJson == null || rawGraphJson.isBlank()) {
            throw new FlowParseException("failed to parse flow data: empty document");
        }
        try {
            FlowGraph graph = objectMapper.readValue(rawGraphJson, FlowGraph.class);
            if (graph == null) {
                throw new FlowParseException("failed to parse flow data: document is null");
            }
            return graph;
        } catch (JsonProcessingException e) {
            throw new FlowParseException("failed to parse flow data: " + e.getOriginalMessage(), e);
        }
    }
}
