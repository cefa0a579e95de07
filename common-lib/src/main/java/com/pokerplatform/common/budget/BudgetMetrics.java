package com.pokerplatform.common.budget;

/**
 * Rolling latency summary for one component across cycles.
 */
public record BudgetMetrics(
    int samples,
    double p50,
    double p95,
    double p99,
    long lastSample
) {
    public static final BudgetMetrics EMPTY = new BudgetMetrics(0, 0.0, 0.0, 0.0, 0L);
}
