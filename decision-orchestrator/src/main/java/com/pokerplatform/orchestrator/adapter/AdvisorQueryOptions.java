package com.pokerplatform.orchestrator.adapter;

/**
 * Query knobs. {@code budgetOverrideMs} lets the caller cap the ensemble's internal
 * budget regardless of its own configuration.
 */
public record AdvisorQueryOptions(
    long budgetOverrideMs,
    boolean disableCostGuard
) {
    public static AdvisorQueryOptions withBudget(long budgetOverrideMs) {
        return new AdvisorQueryOptions(budgetOverrideMs, false);
    }
}
