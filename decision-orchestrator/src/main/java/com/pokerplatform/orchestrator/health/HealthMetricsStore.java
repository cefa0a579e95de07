package com.pokerplatform.orchestrator.health;

import com.pokerplatform.common.health.HealthState;
import com.pokerplatform.common.health.HealthStatus;
import com.pokerplatform.common.health.PanicStopType;
import com.pokerplatform.common.model.StrategyDecision;
import com.pokerplatform.orchestrator.config.HealthMonitoringSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest telemetry per subsystem (vision, solver, executor, strategy) and the rules that
 * turn it into a {@link HealthStatus}.
 *
 * <p>Writers are the decision cycle; readers are the monitor's checks. Each subsystem
 * buffer has its own lock, so a slow reader of one never blocks a writer of another.
 *
 * <p>A subsystem that has never reported is stale. Reading the solver or strategy status
 * clears its transient counter (timeouts, fallbacks), so each tick only sees what
 * happened since the previous one.
 */
public class HealthMetricsStore {

    private static final Logger log = LoggerFactory.getLogger(HealthMetricsStore.class);

    static final String VISION   = "vision";
    static final String SOLVER   = "solver";
    static final String EXECUTOR = "executor";
    static final String STRATEGY = "strategy";

    private static final int EXECUTOR_WINDOW = 100;

    private final HealthMonitoringSettings.Staleness staleness;
    private final HealthMonitoringSettings.PanicStop panicStop;
    private final PanicTrigger panicTrigger;
    private final Clock clock;

    private final VisionBuffer vision = new VisionBuffer();
    private final SolverBuffer solver = new SolverBuffer();
    private final ExecutorBuffer executor = new ExecutorBuffer();
    private final StrategyBuffer strategy = new StrategyBuffer();

    public HealthMetricsStore(HealthMonitoringSettings settings, PanicTrigger panicTrigger, Clock clock) {
        this.staleness    = settings.staleness();
        this.panicStop    = settings.panicStop();
        this.panicTrigger = panicTrigger;
        this.clock        = clock;
    }

    // ── writers ───────────────────────────────────────────────────────────────

    /**
     * Records one parsed frame's confidence. The panic trigger fires once, on the frame that
     * brings the run of frames below {@code minConfidence} to {@code visionConfidenceFrames}.
     * Longer runs do not fire again; a confident frame starts a new run.
     */
    public void recordVisionSample(double confidence, Instant at) {
        boolean fire;
        int streak;
        synchronized (vision) {
            vision.lastConfidence = confidence;
            vision.lastUpdated = at;
            vision.lowStreak = confidence < panicStop.minConfidence() ? vision.lowStreak + 1 : 0;
            streak = vision.lowStreak;
            fire = streak == Math.max(1, panicStop.visionConfidenceFrames());
        }
        if (fire && panicTrigger != null) {
            log.warn("[HealthMetrics] low vision confidence streak. confidence={} streak={}", confidence, streak);
            panicTrigger.trigger(PanicStopType.VISION_CONFIDENCE,
                String.format("Vision confidence %.3f below %s", confidence, panicStop.minConfidence()));
        }
    }

    public void recordSolverSample(long latencyMs, boolean timedOut, Instant at) {
        synchronized (solver) {
            solver.lastLatencyMs = latencyMs;
            solver.lastUpdated = at;
            if (timedOut) {
                solver.timedOutSamples++;
            }
        }
    }

    public void recordExecutorSample(boolean success, Instant at) {
        synchronized (executor) {
            executor.total++;
            if (!success) {
                executor.failures++;
            }
            executor.lastUpdated = at;
        }
    }

    public void recordStrategySample(StrategyDecision decision, Instant at) {
        if (decision == null) {
            return;
        }
        synchronized (strategy) {
            strategy.lastDivergencePp = decision.reasoning() != null ? decision.reasoning().divergence() : 0.0;
            if (decision.reasoning() != null && decision.reasoning().fallbackReason() != null) {
                strategy.fallbackCount++;
            }
            strategy.lastUpdated = at;
        }
    }

    // ── status builders ───────────────────────────────────────────────────────

    public HealthStatus buildVisionStatus(double minConfidence) {
        Instant now = clock.instant();
        synchronized (vision) {
            Map<String, Double> metrics = new LinkedHashMap<>();
            metrics.put("confidence", vision.lastConfidence);
            metrics.put("lowConfidenceStreak", (double) vision.lowStreak);

            HealthState state = HealthState.HEALTHY;
            String details = null;
            if (isStale(vision.lastUpdated, staleness.visionFailedMs(), now)) {
                state = HealthState.FAILED;
                details = "stale vision feed";
            } else if (vision.lastConfidence < minConfidence) {
                state = HealthState.DEGRADED;
                details = String.format("vision confidence %.3f below %s", vision.lastConfidence, minConfidence);
            }
            vision.failures = state == HealthState.HEALTHY ? 0 : vision.failures + 1;
            return new HealthStatus(VISION, state, now, details, metrics, vision.failures);
        }
    }

    public HealthStatus buildSolverStatus(long latencyThresholdMs) {
        Instant now = clock.instant();
        synchronized (solver) {
            Map<String, Double> metrics = new LinkedHashMap<>();
            metrics.put("latencyMs", (double) solver.lastLatencyMs);
            metrics.put("timedOutSamples", (double) solver.timedOutSamples);

            HealthState state = HealthState.HEALTHY;
            String details = null;
            if (isStale(solver.lastUpdated, staleness.solverMs(), now)) {
                state = HealthState.DEGRADED;
                details = "solver stats stale";
            } else if (solver.lastLatencyMs > latencyThresholdMs) {
                state = HealthState.DEGRADED;
                details = "solver latency " + solver.lastLatencyMs + "ms above " + latencyThresholdMs + "ms";
            } else if (solver.timedOutSamples > 0) {
                state = HealthState.DEGRADED;
                details = "recent solver timeout";
            }
            solver.timedOutSamples = 0;
            solver.failures = state == HealthState.HEALTHY ? 0 : solver.failures + 1;
            return new HealthStatus(SOLVER, state, now, details, metrics, solver.failures);
        }
    }

    public HealthStatus buildExecutorStatus(double failureRateMax) {
        Instant now = clock.instant();
        synchronized (executor) {
            double rate = executor.total == 0 ? 0.0 : (double) executor.failures / executor.total;
            Map<String, Double> metrics = new LinkedHashMap<>();
            metrics.put("failureRate", rate);
            metrics.put("samples", (double) executor.total);

            HealthState state = HealthState.HEALTHY;
            String details = null;
            if (isStale(executor.lastUpdated, staleness.executorMs(), now)) {
                state = HealthState.DEGRADED;
                details = "executor idle";
            } else if (rate > failureRateMax) {
                state = HealthState.DEGRADED;
                details = String.format("executor failure rate %.3f above %s", rate, failureRateMax);
            }
            if (executor.total > EXECUTOR_WINDOW) {
                executor.total = EXECUTOR_WINDOW;
                executor.failures = Math.min(executor.failures, executor.total);
            }
            executor.consecutiveFailures = state == HealthState.HEALTHY ? 0 : executor.consecutiveFailures + 1;
            return new HealthStatus(EXECUTOR, state, now, details, metrics, executor.consecutiveFailures);
        }
    }

    public HealthStatus buildStrategyStatus(double divergenceMaxPp) {
        Instant now = clock.instant();
        synchronized (strategy) {
            Map<String, Double> metrics = new LinkedHashMap<>();
            metrics.put("divergencePp", strategy.lastDivergencePp);
            metrics.put("fallbacks", (double) strategy.fallbackCount);

            HealthState state = HealthState.HEALTHY;
            String details = null;
            if (isStale(strategy.lastUpdated, staleness.strategyMs(), now)) {
                state = HealthState.DEGRADED;
                details = "strategy stats stale";
            } else if (strategy.lastDivergencePp > divergenceMaxPp) {
                state = HealthState.DEGRADED;
                details = String.format("strategy divergence %.1fpp above %s", strategy.lastDivergencePp,
                    divergenceMaxPp);
            } else if (strategy.fallbackCount > 0) {
                state = HealthState.DEGRADED;
                details = "recent strategy fallback";
            }
            strategy.fallbackCount = 0;
            strategy.failures = state == HealthState.HEALTHY ? 0 : strategy.failures + 1;
            return new HealthStatus(STRATEGY, state, now, details, metrics, strategy.failures);
        }
    }

    private static boolean isStale(Instant lastUpdated, long maxAgeMs, Instant now) {
        return lastUpdated == null || now.toEpochMilli() - lastUpdated.toEpochMilli() > maxAgeMs;
    }

    // ── buffers ───────────────────────────────────────────────────────────────

    private static final class VisionBuffer {
        double lastConfidence;
        Instant lastUpdated;
        int lowStreak;
        int failures;
    }

    private static final class SolverBuffer {
        long lastLatencyMs;
        Instant lastUpdated;
        int timedOutSamples;
        int failures;
    }

    private static final class ExecutorBuffer {
        int total;
        int failures;
        Instant lastUpdated;
        int consecutiveFailures;
    }

    private static final class StrategyBuffer {
        double lastDivergencePp;
        int fallbackCount;
        Instant lastUpdated;
        int failures;
    }
}
