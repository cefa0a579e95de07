package com.pokerplatform.common.budget;

/**
 * Pipeline stages that share one decision-cycle deadline, in execution order.
 * {@link #BUFFER} is not a stage; it absorbs scheduling slack and overruns.
 */
public enum BudgetComponent {
    PERCEPTION,
    GTO,
    AGENTS,
    SYNTHESIS,
    EXECUTION,
    BUFFER
}
