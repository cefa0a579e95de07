package com.pokerplatform.orchestrator.config;

import com.pokerplatform.common.budget.BudgetAllocation;
import com.pokerplatform.common.budget.TimeBudgetTracker;

/**
 * Decision-cycle budget configuration.
 *
 * <ul>
 *   <li>{@code gtoDefaultMs}      — solver budget requested when the tracker allows it</li>
 *   <li>{@code agentsHardCapMs}   — ceiling on the advisor ensemble's deadline</li>
 *   <li>{@code zeroBudgetGraceMs} — how long the solver's zero-budget fast path may take
 *       before it is abandoned too</li>
 * </ul>
 */
public record BudgetSettings(
    long totalMs,
    BudgetAllocation allocation,
    long preemptEpsilonMs,
    long gtoDefaultMs,
    long agentsHardCapMs,
    long zeroBudgetGraceMs
) {
    public static BudgetSettings defaults() {
        return new BudgetSettings(BudgetAllocation.DEFAULT_TOTAL_BUDGET_MS, BudgetAllocation.DEFAULTS,
            TimeBudgetTracker.DEFAULT_PREEMPT_EPSILON_MS, 400, 200, 50);
    }

    public TimeBudgetTracker newTracker() {
        return new TimeBudgetTracker(totalMs, allocation, () -> System.nanoTime() / 1_000_000L,
            preemptEpsilonMs, TimeBudgetTracker.DEFAULT_METRICS_WINDOW);
    }
}
