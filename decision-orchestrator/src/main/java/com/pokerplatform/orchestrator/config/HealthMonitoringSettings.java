package com.pokerplatform.orchestrator.config;

/**
 * Health monitoring, safe-mode and panic-stop configuration. Read-only once built.
 */
public record HealthMonitoringSettings(
    long intervalMs,
    DegradedThresholds thresholds,
    Staleness staleness,
    SafeMode safeMode,
    PanicStop panicStop
) {

    /**
     * @param visionConfidenceMin  vision confidence below this is degraded
     * @param solverLatencyMs      solver latency above this is degraded
     * @param executorFailureRate  executor failure rate above this is degraded
     * @param strategyDivergencePp GTO/advisor divergence above this is degraded
     */
    public record DegradedThresholds(
        double visionConfidenceMin,
        long solverLatencyMs,
        double executorFailureRate,
        double strategyDivergencePp
    ) {}

    /** Maximum sample age per subsystem before its status goes stale. */
    public record Staleness(
        long visionFailedMs,
        long solverMs,
        long executorMs,
        long strategyMs
    ) {}

    public record SafeMode(
        boolean enabled,
        boolean autoExit,
        int autoExitHealthyStreak
    ) {}

    public record PanicStop(
        int visionConfidenceFrames,
        double minConfidence
    ) {}

    public static HealthMonitoringSettings defaults() {
        return new HealthMonitoringSettings(
            2000,
            new DegradedThresholds(0.995, 500, 0.05, 30.0),
            new Staleness(15_000, 30_000, 30_000, 60_000),
            new SafeMode(true, true, 2),
            new PanicStop(3, 0.99));
    }
}
