package com.pokerplatform.common.budget;

import java.util.EnumMap;
import java.util.Map;

/**
 * Planned milliseconds per {@link BudgetComponent} inside one cycle.
 *
 * <p>Negative values are clamped to zero. Whether the allocation fits inside a total
 * deadline is checked by {@link #fitsWithin(long)}; the tracker tolerates an allocation
 * that does not fit because the global deadline still caps every stage.
 */
public record BudgetAllocation(
    long perception,
    long gto,
    long agents,
    long synthesis,
    long execution,
    long buffer
) {
    public static final long DEFAULT_TOTAL_BUDGET_MS = 2000;

    public static final BudgetAllocation DEFAULTS = new BudgetAllocation(70, 400, 1200, 100, 30, 200);

    public BudgetAllocation {
        perception = Math.max(0, perception);
        gto        = Math.max(0, gto);
        agents     = Math.max(0, agents);
        synthesis  = Math.max(0, synthesis);
        execution  = Math.max(0, execution);
        buffer     = Math.max(0, buffer);
    }

    public long get(BudgetComponent component) {
        return switch (component) {
            case PERCEPTION -> perception;
            case GTO        -> gto;
            case AGENTS     -> agents;
            case SYNTHESIS  -> synthesis;
            case EXECUTION  -> execution;
            case BUFFER     -> buffer;
        };
    }

    public long sum() {
        return perception + gto + agents + synthesis + execution + buffer;
    }

    public boolean fitsWithin(long totalBudgetMs) {
        return sum() <= totalBudgetMs;
    }

    public Map<BudgetComponent, Long> toMap() {
        Map<BudgetComponent, Long> map = new EnumMap<>(BudgetComponent.class);
        for (BudgetComponent component : BudgetComponent.values()) {
            map.put(component, get(component));
        }
        return map;
    }

    public static BudgetAllocation fromMap(Map<BudgetComponent, Long> values) {
        return new BudgetAllocation(
            values.getOrDefault(BudgetComponent.PERCEPTION, 0L),
            values.getOrDefault(BudgetComponent.GTO, 0L),
            values.getOrDefault(BudgetComponent.AGENTS, 0L),
            values.getOrDefault(BudgetComponent.SYNTHESIS, 0L),
            values.getOrDefault(BudgetComponent.EXECUTION, 0L),
            values.getOrDefault(BudgetComponent.BUFFER, 0L));
    }
}
