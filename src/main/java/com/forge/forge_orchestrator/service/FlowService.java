package com.forge.forge_orchestrator.service;

import com.forge.forge_orchestrator.engine.FlowExecutionEngine;
import com.forge.forge_orchestrator.engine.FlowRunResult;
import com.forge.forge_orchestrator.exception.FlowNotFoundException;
import com.forge.forge_orchestrator.model.domain.Flow;
import com.forge.forge_orchestrator.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class FlowService {

    private final FlowExecutionEngine engine;
    private final FlowRepository flowRepository;

    public List<Flow> listFlows() {
        return flowRepository.findAll();
    }

    public Flow getFlow(long flowId) {
        return flowRepository.findById(flowId).orElseThrow(() -> new FlowNotFoundException(flowId));
    }

    public Flow createFlow(Flow flow) {
        String name = requireName(flow.getName());
        if (flowRepository.existsByName(name)) {
            throw new IllegalArgumentException("a flow named '" + name + "' already exists");
        }
        flow.setId(null);
        flow.setName(name);
        return flowRepository.save(flow);
    }

    /** Full replacement, as the editor always sends the whole flow. */
    public Flow updateFlow(long flowId, Flow changes) {
        Flow flow = getFlow(flowId);
        String name = requireName(changes.getName());
        if (!name.equals(flow.getName()) && flowRepository.existsByName(name)) {
            throw new IllegalArgumentException("a flow named '" + name + "' already exists");
        }
        flow.setName(name);
        flow.setDescription(changes.getDescription());
        flow.setGraphJson(changes.getGraphJson() != null ? changes.getGraphJson() : Flow.EMPTY_GRAPH);
        if (changes.getStatus() != null) {
            flow.setStatus(changes.getStatus());
        }
        return flowRepository.save(flow);
    }

    public void deleteFlow(long flowId) {
        if (!flowRepository.existsById(flowId)) {
            throw new FlowNotFoundException(flowId);
        }
        flowRepository.deleteById(flowId);
    }

    /**
     * Starts the flow on a background thread and returns immediately so the
     * caller can watch progress over the hub or poll the status endpoint.
     * Two triggers for the same flow are not serialized.
     */
    public CompletableFuture<Void> triggerFlow(long flowId) {
        if (!flowRepository.existsById(flowId)) {
            throw new FlowNotFoundException(flowId);
        }
        return CompletableFuture.runAsync(() -> runInBackground(flowId));
    }

    /** Runs the flow on the calling thread; failures propagate. */
    public FlowRunResult runFlow(long flowId) {
        return engine.execute(flowId);
    }

    private void runInBackground(long flowId) {
        try {
            engine.execute(flowId);
        } catch (RuntimeException ex) {
            // Already reported as FLOW_FAILED and a FAILED status.
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Background run of flow {} failed: {}", flowId, msg);
        }
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("flow name is required");
        }
        return name.trim();
    }
}
