package com.forge.forge_orchestrator.engine;

/** Summary of a run that reached FLOW_COMPLETED. */
public record FlowRunResult(
    long   flowId,
    int    nodesExecuted,
    double totalCost,
    long   executionTimeMs
) {}
