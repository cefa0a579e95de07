package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final action chosen by strategy blending, with its trace and observability flags.
 *
 * <p>{@code usedGtoOnlyFallback} is set when advisor input was ignored, {@code panicStop}
 * when the risk layer forced a stop action.
 */
public record StrategyDecision(
    @JsonProperty("action")              Action action,
    @JsonProperty("reasoning")           StrategyReasoning reasoning,
    @JsonProperty("timing")              StrategyTiming timing,
    @JsonProperty("usedGtoOnlyFallback") boolean usedGtoOnlyFallback,
    @JsonProperty("panicStop")           boolean panicStop
) {}
