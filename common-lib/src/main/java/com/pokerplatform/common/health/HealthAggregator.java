package com.pokerplatform.common.health;

import java.util.Collection;

/**
 * Folds per-component verdicts into one overall state.
 *
 * <p>Stateless and thread-safe.
 */
public final class HealthAggregator {

    private HealthAggregator() {}

    /**
     * {@code FAILED} if any status failed, else {@code DEGRADED} if any degraded, else
     * {@code HEALTHY}. An empty or {@code null} collection is healthy. Independent of order.
     */
    public static HealthState computeOverallHealth(Collection<HealthStatus> statuses) {
        HealthState overall = HealthState.HEALTHY;
        if (statuses == null) {
            return overall;
        }
        for (HealthStatus status : statuses) {
            if (status != null) {
                overall = overall.worst(status.state());
            }
        }
        return overall;
    }
}
