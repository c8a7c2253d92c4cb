package com.forge.forge_orchestrator.controller;

import com.forge.forge_orchestrator.model.domain.TokenLedgerEntry;
import com.forge.forge_orchestrator.model.ledger.BudgetSummary;
import com.forge.forge_orchestrator.service.LedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerService ledgerService;

    /** All entries of one flow in run order, or the latest entries across flows. */
    @GetMapping("/ledger")
    public List<TokenLedgerEntry> getEntries(@RequestParam(required = false) Long flowId,
                                             @RequestParam(required = false) Integer limit) {
        return flowId != null ? ledgerService.entriesForFlow(flowId) : ledgerService.recent(limit);
    }

    @GetMapping("/budget")
    public BudgetSummary getBudget(@RequestParam(required = false) String model) {
        return ledgerService.budget(model);
    }
}
