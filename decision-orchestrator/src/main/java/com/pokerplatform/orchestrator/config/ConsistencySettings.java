package com.pokerplatform.orchestrator.config;

import com.pokerplatform.common.consistency.StateConsistencyChecker;

public record ConsistencySettings(
    double epsilon,
    boolean panicOnViolation,
    double confidenceDropMax,
    int parseErrorFrames
) {
    public static ConsistencySettings defaults() {
        return new ConsistencySettings(StateConsistencyChecker.DEFAULT_EPSILON, true,
            StateConsistencyChecker.DEFAULT_CONFIDENCE_DROP_MAX, StateConsistencyChecker.DEFAULT_PARSE_ERROR_FRAMES);
    }

    public StateConsistencyChecker newChecker() {
        return new StateConsistencyChecker(epsilon, confidenceDropMax);
    }
}
