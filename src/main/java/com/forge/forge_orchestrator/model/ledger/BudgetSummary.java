package com.forge.forge_orchestrator.model.ledger;

/**
 * Today's spend against the daily budget, as shown by the budget meter.
 * {@code remainingBudget} never goes below zero.
 */
public record BudgetSummary(
    double totalBudget,
    double spentToday,
    double remainingBudget,
    int remainingPrompts,
    String costUnit,
    String model
) {}
