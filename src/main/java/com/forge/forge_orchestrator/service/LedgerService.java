package com.forge.forge_orchestrator.service;

import com.forge.forge_orchestrator.config.ForgeProperties;
import com.forge.forge_orchestrator.exception.LedgerWriteException;
import com.forge.forge_orchestrator.model.domain.TokenLedgerEntry;
import com.forge.forge_orchestrator.model.ledger.BudgetSummary;
import com.forge.forge_orchestrator.repository.TokenLedgerRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/** Append-only cost record: one entry per agent-node attempt. */
@Service
public class LedgerService {

    private final TokenLedgerRepository repository;
    private final ForgeProperties.Ledger settings;
    private final Clock clock;

    @Autowired
    public LedgerService(TokenLedgerRepository repository, ForgeProperties properties) {
        this(repository, properties, Clock.systemUTC());
    }

    LedgerService(TokenLedgerRepository repository, ForgeProperties properties, Clock clock) {
        this.repository = repository;
        this.settings = properties.getLedger();
        this.clock = clock;
    }

    public TokenLedgerEntry append(TokenLedgerEntry entry) {
        try {
            return repository.save(entry);
        } catch (RuntimeException e) {
            throw new LedgerWriteException("failed to record ledger entry for flow " + entry.getFlowId(), e);
        }
    }

    public List<TokenLedgerEntry> entriesForFlow(long flowId) {
        return repository.findByFlowIdOrderByTimestampAsc(flowId);
    }

    /** Latest entries across all flows, newest first. A missing or non-positive limit means the default. */
    public List<TokenLedgerEntry> recent(Integer limit) {
        int size = limit != null && limit > 0 ? limit : settings.getDefaultLimit();
        return repository.findAllByOrderByTimestampDesc(PageRequest.of(0, size));
    }

    public BudgetSummary budget(String model) {
        String effectiveModel = model == null || model.isBlank() ? settings.getDefaultModel() : model.trim();
        Instant startOfDay = LocalDate.now(clock).atStartOfDay(ZoneOffset.UTC).toInstant();

        double spentToday = repository.sumCostSince(startOfDay);
        double total = settings.getDailyBudget();
        double remaining = Math.max(0.0, total - spentToday);
        double promptCost = settings.getPromptCostByModel().getOrDefault(effectiveModel, settings.getAveragePromptCost());
        int remainingPrompts = promptCost > 0 ? (int) (remaining / promptCost) : 0;

        return new BudgetSummary(total, spentToday, remaining, remainingPrompts, "TOKEN", effectiveModel);
    }
}
