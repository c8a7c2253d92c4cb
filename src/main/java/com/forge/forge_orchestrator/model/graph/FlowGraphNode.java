package com.forge.forge_orchestrator.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One canvas node. Only {@code type == "agent"} nodes are executed. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowGraphNode(
    String id,
    String type,
    NodeData data
) {
    public static final String AGENT_TYPE = "agent";

    public NodeData data() {
        return data != null ? data : NodeData.EMPTY;
    }

    public boolean isAgent() {
        return AGENT_TYPE.equals(type);
    }
}
