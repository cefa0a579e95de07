package com.pokerplatform.orchestrator.health;

import com.pokerplatform.common.health.HealthStatus;

/**
 * One named check run by the {@link HealthMonitor} on every tick. A thrown exception is
 * recorded as a failed status for that check.
 */
@FunctionalInterface
public interface HealthCheck {

    HealthStatus run() throws Exception;
}
