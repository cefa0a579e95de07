package com.pokerplatform.orchestrator.logger;

import com.pokerplatform.common.model.StrategyDecision;
import com.pokerplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the decision cycle.
 *
 * <p>Logs each stage a cycle passes through without touching pipeline behavior. All
 * methods are pure side-effects.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #CYCLE_STARTED}       — tracker started for the session</li>
 *   <li>{@link #CONSISTENCY_CHECKED} — parsed frame compared with the previous one</li>
 *   <li>{@link #GTO_RESOLVED}        — solver answered, or its fallback was substituted</li>
 *   <li>{@link #ADVISORS_RESOLVED}   — advisor ensemble answered, or was stubbed</li>
 *   <li>{@link #DECISION_BLENDED}    — strategy blender returned the decision</li>
 *   <li>{@link #CYCLE_COMPLETED}     — outcome gated by safe mode and panic stop</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.GTO_RESOLVED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String CYCLE_STARTED       = "CYCLE_STARTED";
    public static final String CONSISTENCY_CHECKED = "CONSISTENCY_CHECKED";
    public static final String GTO_RESOLVED        = "GTO_RESOLVED";
    public static final String ADVISORS_RESOLVED   = "ADVISORS_RESOLVED";
    public static final String DECISION_BLENDED    = "DECISION_BLENDED";
    public static final String CYCLE_COMPLETED     = "CYCLE_COMPLETED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * The traceId comes from the Reactor Context carried by the signal, never from MDC.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /**
     * Logs a stage when the traceId is already at hand, e.g. outside a Reactor chain.
     */
    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /**
     * Compact summary of a finished cycle: hand, action, flags and the gate verdict.
     */
    public void logOutcome(String handId, StrategyDecision decision, boolean solverTimedOut,
                           boolean actionable, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} handId={} action={} gtoOnly={} solverTimedOut={} "
                     + "actionable={} traceId={}",
                     CYCLE_COMPLETED,
                     handId,
                     decision != null && decision.action() != null ? decision.action().key() : "N/A",
                     decision != null && decision.usedGtoOnlyFallback(),
                     solverTimedOut, actionable, traceId)
        );
    }
}
