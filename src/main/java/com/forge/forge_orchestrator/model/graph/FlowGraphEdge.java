package com.forge.forge_orchestrator.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowGraphEdge(
    String id,
    String source,
    String target
) {}
