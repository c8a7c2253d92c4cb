package com.forge.forge_orchestrator.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;

/**
 * Parsed form of a flow's stored graph.
 * Null-safe: missing lists are treated as empty. Node order is execution order;
 * edges are kept for the editor but never drive scheduling.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowGraph(
    List<FlowGraphNode> nodes,
    List<FlowGraphEdge> edges
) {
    public List<FlowGraphNode> nodes() {
        return nodes != null ? nodes : Collections.emptyList();
    }

    public List<FlowGraphEdge> edges() {
        return edges != null ? edges : Collections.emptyList();
    }

    public List<FlowGraphNode> agentNodes() {
        return nodes().stream().filter(FlowGraphNode::isAgent).toList();
    }
}
