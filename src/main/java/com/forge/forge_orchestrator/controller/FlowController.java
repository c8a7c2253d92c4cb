package com.forge.forge_orchestrator.controller;

import com.forge.forge_orchestrator.engine.FlowRunResult;
import com.forge.forge_orchestrator.model.domain.Flow;
import com.forge.forge_orchestrator.model.status.FlowState;
import com.forge.forge_orchestrator.service.FlowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/flows")
@RequiredArgsConstructor
public class FlowController {

    private final FlowService flowService;

    @GetMapping
    public List<Flow> getAllFlows() {
        return flowService.listFlows();
    }

    @PostMapping
    public ResponseEntity<Flow> createFlow(@RequestBody Flow flow) {
        return ResponseEntity.status(HttpStatus.CREATED).body(flowService.createFlow(flow));
    }

    @GetMapping("/{flowId}")
    public Flow getFlow(@PathVariable long flowId) {
        return flowService.getFlow(flowId);
    }

    @PutMapping("/{flowId}")
    public Flow updateFlow(@PathVariable long flowId, @RequestBody Flow flow) {
        return flowService.updateFlow(flowId, flow);
    }

    @DeleteMapping("/{flowId}")
    public ResponseEntity<Void> deleteFlow(@PathVariable long flowId) {
        flowService.deleteFlow(flowId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Runs the flow. By default returns 202 at once and the run continues in the
     * background; {@code wait=true} blocks until the run finishes.
     */
    @PostMapping("/{flowId}/execute")
    public ResponseEntity<?> executeFlow(@PathVariable long flowId,
                                         @RequestParam(defaultValue = "false") boolean wait) {
        if (wait) {
            FlowRunResult result = flowService.runFlow(flowId);
            return ResponseEntity.ok(result);
        }
        flowService.triggerFlow(flowId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("flowId", flowId);
        body.put("status", FlowState.RUNNING.name());
        return ResponseEntity.accepted().body(body);
    }
}
