package com.forge.forge_orchestrator.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeData(
    String label,
    String role,     // e.g. "planner", "coder"
    String prompt,   // task handed to the agent
    String provider  // e.g. "Anthropic", "OpenAI"
) {
    static final NodeData EMPTY = new NodeData(null, null, null, null);
}
