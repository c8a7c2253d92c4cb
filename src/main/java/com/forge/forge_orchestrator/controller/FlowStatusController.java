package com.forge.forge_orchestrator.controller;

import com.forge.forge_orchestrator.model.status.FlowStatus;
import com.forge.forge_orchestrator.signal.FileStatusSignaler;
import com.forge.forge_orchestrator.signal.LiveStatusSignaler;
import com.forge.forge_orchestrator.signal.StatusSignaler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Pull endpoint for clients that missed live pushes, e.g. after a reconnect.
 * Reads the durable file by default since it survives restarts.
 */
@RestController
@RequestMapping("/api/flows")
public class FlowStatusController {

    private final StatusSignaler durable;
    private final StatusSignaler live;

    public FlowStatusController(FileStatusSignaler durable, LiveStatusSignaler live) {
        this.durable = durable;
        this.live = live;
    }

    @GetMapping("/{flowId}/status")
    public FlowStatus getStatus(@PathVariable long flowId,
                                @RequestParam(defaultValue = "durable") String source) {
        return switch (source.toLowerCase()) {
            case "durable", "file" -> durable.getStatus(flowId);
            case "live", "memory" -> live.getStatus(flowId);
            default -> throw new IllegalArgumentException("unknown status source: " + source);
        };
    }
}
