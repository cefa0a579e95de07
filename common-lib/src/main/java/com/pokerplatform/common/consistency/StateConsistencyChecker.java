package com.pokerplatform.common.consistency;

import com.pokerplatform.common.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detects a contradictory world model by comparing each parsed frame with the previous
 * frame of the same hand.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li><b>Pot monotonicity</b> — the pot never shrinks inside a hand.</li>
 *   <li><b>Phantom chips</b> — a stack may only grow by chips the pot gave up in the same
 *       step; any growth beyond that is reported per seat.</li>
 *   <li><b>Chip conservation</b> — over the seats seen in both frames,
 *       {@code Δstacks + Δpot} stays within {@code epsilon} of zero. This catches leaks
 *       the two rules above miss, e.g. a blind deducted from a stack that never reached
 *       the pot.</li>
 *   <li><b>Confidence drop</b> — overall parser confidence falling by more than
 *       {@code confidenceDropMax} between frames.</li>
 * </ul>
 *
 * <p>A change of hand id is the only point where the retained frame is discarded; the new
 * frame becomes the baseline and is not compared. The checker also counts consecutive
 * frames that carried parser errors, across hands.
 *
 * <p>Violations are reported, never thrown. Routing them into panic stop is the caller's job.
 */
public class StateConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(StateConsistencyChecker.class);

    public static final double DEFAULT_EPSILON = 0.01;
    public static final double DEFAULT_CONFIDENCE_DROP_MAX = 0.3;
    public static final int DEFAULT_PARSE_ERROR_FRAMES = 5;

    private final double epsilon;
    private final double confidenceDropMax;

    private TableFrame previous;
    private int parseErrorStreak;

    public StateConsistencyChecker() {
        this(DEFAULT_EPSILON, DEFAULT_CONFIDENCE_DROP_MAX);
    }

    public StateConsistencyChecker(double epsilon, double confidenceDropMax) {
        this.epsilon = Math.max(0.0, epsilon);
        this.confidenceDropMax = confidenceDropMax;
    }

    public synchronized ConsistencyReport check(TableFrame frame) {
        if (frame == null) {
            return ConsistencyReport.clean(null);
        }
        parseErrorStreak = frame.parseErrors().isEmpty() ? 0 : parseErrorStreak + 1;

        TableFrame prior = previous;
        previous = frame;
        if (prior == null || !Objects.equals(prior.handId(), frame.handId())) {
            if (prior != null) {
                log.debug("[StateConsistency] hand boundary. previousHandId={} handId={}",
                    prior.handId(), frame.handId());
            }
            return ConsistencyReport.clean(frame.handId());
        }

        List<String> violations = new ArrayList<>();
        double potDelta = frame.pot() - prior.pot();

        if (potDelta < -epsilon) {
            violations.add(String.format("Pot decreased from %.2f to %.2f", prior.pot(), frame.pot()));
        }

        // Chips the pot released this step; stack growth may draw on them once.
        double released = Math.max(0.0, -potDelta);
        double stackDelta = 0.0;
        for (Map.Entry<Position, Double> seat : frame.stacks().entrySet()) {
            Double before = prior.stacks().get(seat.getKey());
            if (before == null) {
                continue;
            }
            double growth = seat.getValue() - before;
            stackDelta += growth;
            if (growth <= epsilon) {
                continue;
            }
            if (growth <= released + epsilon) {
                released = Math.max(0.0, released - growth);
            } else {
                violations.add(String.format("Stack increased unexpectedly for %s: %.2f -> %.2f",
                    seat.getKey(), before, seat.getValue()));
            }
        }

        double residual = stackDelta + potDelta;
        if (Math.abs(residual) > epsilon) {
            violations.add(String.format(
                "Chip conservation violated: stacks changed by %.2f, pot by %.2f (residual %.2f)",
                stackDelta, potDelta, residual));
        }

        double confidenceDrop = prior.confidence() - frame.confidence();
        if (confidenceDrop > confidenceDropMax) {
            violations.add(String.format("Sudden confidence drop: %.2f", confidenceDrop));
        }

        if (!violations.isEmpty()) {
            log.warn("[StateConsistency] violations detected. handId={} count={} first={}",
                frame.handId(), violations.size(), violations.get(0));
        }
        return new ConsistencyReport(frame.handId(), violations);
    }

    /** Forgets the retained frame; the next frame starts a fresh baseline. */
    public synchronized void reset() {
        previous = null;
        parseErrorStreak = 0;
    }

    public synchronized int consecutiveParseErrorFrames() {
        return parseErrorStreak;
    }

    public synchronized boolean shouldTriggerEmergencyStop(int threshold) {
        return parseErrorStreak >= threshold;
    }
}
