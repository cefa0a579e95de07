package com.pokerplatform.orchestrator.service;

import com.pokerplatform.common.budget.BudgetComponent;
import com.pokerplatform.common.budget.BudgetMetrics;
import com.pokerplatform.common.budget.TimeBudgetTracker;
import com.pokerplatform.common.consistency.ConsistencyReport;
import com.pokerplatform.common.consistency.StateConsistencyChecker;
import com.pokerplatform.common.consistency.TableFrame;
import com.pokerplatform.common.exception.DecisionPipelineException;
import com.pokerplatform.common.health.PanicStopType;
import com.pokerplatform.common.health.SafeModeState;
import com.pokerplatform.common.model.GameState;
import com.pokerplatform.common.trace.TraceContextUtil;
import com.pokerplatform.orchestrator.config.BudgetSettings;
import com.pokerplatform.orchestrator.config.ConsistencySettings;
import com.pokerplatform.orchestrator.health.HealthMetricsStore;
import com.pokerplatform.orchestrator.health.PanicStopController;
import com.pokerplatform.orchestrator.health.SafeModeController;
import com.pokerplatform.orchestrator.logger.DecisionFlowLogger;
import com.pokerplatform.orchestrator.pipeline.DecisionPipelineEngine;
import com.pokerplatform.orchestrator.pipeline.DecisionPipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one decision cycle per parsed frame.
 *
 * <p>Per session it keeps one {@link TimeBudgetTracker} and one
 * {@link StateConsistencyChecker}. A cycle starts the tracker, checks the frame inside the
 * {@code PERCEPTION} bracket, runs the {@link DecisionPipelineEngine}, and feeds solver and
 * strategy telemetry into the {@link HealthMetricsStore}.
 *
 * <p>A decision is produced even while panic stop or safe mode is on; the outcome is then
 * marked not actionable. Cycles of one session must not overlap.
 *
 * <p>A session with no cycle for longer than {@code idleTtl} is evicted when the next cycle
 * of any session starts; a later frame for it begins with a fresh baseline.
 */
public class DecisionCycleService {

    private static final Logger log = LoggerFactory.getLogger(DecisionCycleService.class);

    private static final String COMPONENT = "DecisionCycle";
    static final String DEFAULT_SESSION = "default";
    static final Duration DEFAULT_IDLE_TTL = Duration.ofMinutes(30);

    private final DecisionPipelineEngine pipeline;
    private final HealthMetricsStore metrics;
    private final PanicStopController panicStop;
    private final SafeModeController safeMode;
    private final BudgetSettings budgetSettings;
    private final ConsistencySettings consistencySettings;
    private final DecisionFlowLogger flowLogger;
    private final Clock clock;
    private final Duration idleTtl;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public DecisionCycleService(DecisionPipelineEngine pipeline, HealthMetricsStore metrics,
                                PanicStopController panicStop, SafeModeController safeMode,
                                BudgetSettings budgetSettings, ConsistencySettings consistencySettings,
                                DecisionFlowLogger flowLogger, Clock clock) {
        this(pipeline, metrics, panicStop, safeMode, budgetSettings, consistencySettings, flowLogger, clock,
            DEFAULT_IDLE_TTL);
    }

    public DecisionCycleService(DecisionPipelineEngine pipeline, HealthMetricsStore metrics,
                                PanicStopController panicStop, SafeModeController safeMode,
                                BudgetSettings budgetSettings, ConsistencySettings consistencySettings,
                                DecisionFlowLogger flowLogger, Clock clock, Duration idleTtl) {
        this.pipeline            = pipeline;
        this.metrics             = metrics;
        this.panicStop           = panicStop;
        this.safeMode            = safeMode;
        this.budgetSettings      = budgetSettings;
        this.consistencySettings = consistencySettings;
        this.flowLogger          = flowLogger;
        this.clock               = clock;
        this.idleTtl             = idleTtl != null && !idleTtl.isNegative() && !idleTtl.isZero()
            ? idleTtl : DEFAULT_IDLE_TTL;
    }

    public Mono<DecisionCycleOutcome> runCycle(GameState state, String sessionId) {
        if (state == null) {
            return Mono.error(new DecisionPipelineException(COMPONENT, "game state is required"));
        }
        String traceId = UUID.randomUUID().toString();
        Mono<DecisionCycleOutcome> cycle = Mono.defer(() -> {
            evictIdle(sessionKey(sessionId));
            Session session = session(sessionId);
            session.touch(clock.millis());
            TimeBudgetTracker tracker = session.tracker();
            tracker.start();
            flowLogger.logWithTraceId(DecisionFlowLogger.CYCLE_STARTED, traceId);

            List<String> violations = perceive(state, session, traceId);
            return pipeline.makeDecision(state, sessionId, tracker)
                .map(result -> complete(state, tracker, result, violations, traceId));
        });
        return TraceContextUtil.withTraceId(cycle, traceId);
    }

    /** Forwards one executor outcome into executor health. */
    public void recordExecution(boolean success) {
        metrics.recordExecutorSample(success, clock.instant());
    }

    /** Drops the session's tracker and consistency baseline. */
    public void endSession(String sessionId) {
        Session removed = sessions.remove(sessionKey(sessionId));
        if (removed != null) {
            log.info("[DecisionCycle] session ended. sessionId={}", sessionKey(sessionId));
        }
    }

    /** Stage latency percentiles for a session, empty when the session is unknown. */
    public Map<BudgetComponent, BudgetMetrics> budgetMetrics(String sessionId) {
        Session session = sessions.get(sessionKey(sessionId));
        Map<BudgetComponent, BudgetMetrics> out = new EnumMap<>(BudgetComponent.class);
        if (session == null) {
            return out;
        }
        for (BudgetComponent component : BudgetComponent.values()) {
            out.put(component, session.tracker().metricsSnapshot(component));
        }
        return out;
    }

    int activeSessions() {
        return sessions.size();
    }

    // ── stages ────────────────────────────────────────────────────────────────

    private List<String> perceive(GameState state, Session session, String traceId) {
        TimeBudgetTracker tracker = session.tracker();
        tracker.startComponent(BudgetComponent.PERCEPTION);
        try {
            metrics.recordVisionSample(state.confidence(), clock.instant());
            StateConsistencyChecker checker = session.checker();
            ConsistencyReport report = checker.check(TableFrame.from(state));

            if (!report.consistent() && consistencySettings.panicOnViolation()) {
                panicStop.trigger(PanicStopType.VISION_CONFIDENCE,
                    "State inconsistency: " + String.join("; ", report.violations()));
            }
            if (checker.shouldTriggerEmergencyStop(consistencySettings.parseErrorFrames())
                    && consistencySettings.panicOnViolation()) {
                panicStop.trigger(PanicStopType.VISION_CONFIDENCE,
                    "Parse errors in " + checker.consecutiveParseErrorFrames() + " consecutive frames");
            }
            return report.violations();
        } finally {
            tracker.endComponent(BudgetComponent.PERCEPTION);
            flowLogger.logWithTraceId(DecisionFlowLogger.CONSISTENCY_CHECKED, traceId);
        }
    }

    private DecisionCycleOutcome complete(GameState state, TimeBudgetTracker tracker,
                                          DecisionPipelineResult result, List<String> violations,
                                          String traceId) {
        Instant now = clock.instant();
        metrics.recordSolverSample(result.solverLatencyMs(), result.solverTimedOut(), now);
        metrics.recordStrategySample(result.decision(), now);

        String blockedReason = blockedReason();
        boolean actionable = blockedReason == null;
        flowLogger.logOutcome(state.handId(), result.decision(), result.solverTimedOut(), actionable, traceId);
        if (!actionable) {
            log.warn("[DecisionCycle] decision not actionable. handId={} reason={}", state.handId(), blockedReason);
        }
        return new DecisionCycleOutcome(result, violations, actionable, blockedReason);
    }

    private String blockedReason() {
        if (panicStop.isActive()) {
            return panicStop.getReason()
                .map(reason -> "panic stop: " + reason.type().wireName())
                .orElse("panic stop");
        }
        if (safeMode.getState() instanceof SafeModeState.Active active) {
            return "safe mode: " + active.reason();
        }
        return null;
    }

    private Session session(String sessionId) {
        return sessions.computeIfAbsent(sessionKey(sessionId),
            key -> new Session(budgetSettings.newTracker(), consistencySettings.newChecker(),
                new AtomicLong(clock.millis())));
    }

    private void evictIdle(String currentKey) {
        long cutoff = clock.millis() - idleTtl.toMillis();
        sessions.entrySet().removeIf(entry -> {
            boolean idle = !entry.getKey().equals(currentKey) && entry.getValue().lastActiveMs().get() < cutoff;
            if (idle) {
                log.info("[DecisionCycle] idle session evicted. sessionId={} idleTtlMs={}",
                    entry.getKey(), idleTtl.toMillis());
            }
            return idle;
        });
    }

    private static String sessionKey(String sessionId) {
        return sessionId != null && !sessionId.isBlank() ? sessionId : DEFAULT_SESSION;
    }

    private record Session(TimeBudgetTracker tracker, StateConsistencyChecker checker, AtomicLong lastActiveMs) {

        void touch(long nowMs) {
            lastActiveMs.set(nowMs);
        }
    }
}
