package com.pokerplatform.orchestrator.health;

import com.pokerplatform.orchestrator.config.HealthMonitoringSettings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires the metrics-store checks into the monitor at startup and starts the tick loop.
 *
 * <p>{@code health.checks} selects which subsystems are watched; a deployment without an
 * executor, for instance, drops {@code executor} so idleness does not hold safe mode on.
 */
@Component
public class HealthCheckRegistrar {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistrar.class);

    private final HealthMonitor monitor;
    private final HealthMetricsStore store;
    private final HealthMonitoringSettings settings;

    @Value("${health.checks:vision,solver,executor,strategy}")
    private String enabledChecks;

    public HealthCheckRegistrar(HealthMonitor monitor, HealthMetricsStore store, HealthMonitoringSettings settings) {
        this.monitor  = monitor;
        this.store    = store;
        this.settings = settings;
    }

    @PostConstruct
    public void registerAndStart() {
        Set<String> enabled = Arrays.stream(enabledChecks.split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toSet());
        HealthMonitoringSettings.DegradedThresholds thresholds = settings.thresholds();

        if (enabled.contains(HealthMetricsStore.VISION)) {
            monitor.registerCheck(HealthMetricsStore.VISION,
                () -> store.buildVisionStatus(thresholds.visionConfidenceMin()));
        }
        if (enabled.contains(HealthMetricsStore.SOLVER)) {
            monitor.registerCheck(HealthMetricsStore.SOLVER,
                () -> store.buildSolverStatus(thresholds.solverLatencyMs()));
        }
        if (enabled.contains(HealthMetricsStore.EXECUTOR)) {
            monitor.registerCheck(HealthMetricsStore.EXECUTOR,
                () -> store.buildExecutorStatus(thresholds.executorFailureRate()));
        }
        if (enabled.contains(HealthMetricsStore.STRATEGY)) {
            monitor.registerCheck(HealthMetricsStore.STRATEGY,
                () -> store.buildStrategyStatus(thresholds.strategyDivergencePp()));
        }
        log.info("[HealthCheckRegistrar] checks registered. enabled={}", enabled);
        monitor.start();
    }

    @PreDestroy
    public void shutdown() {
        monitor.stop();
    }
}
