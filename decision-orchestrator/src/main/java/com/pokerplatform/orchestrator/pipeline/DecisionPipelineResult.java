package com.pokerplatform.orchestrator.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pokerplatform.common.model.AggregatedAdvisorOutput;
import com.pokerplatform.common.model.GtoSolution;
import com.pokerplatform.common.model.StrategyDecision;

/**
 * Everything one pipeline run produced. {@code solverTimedOut} is true whenever the
 * solver's answer was not a full-budget solve: zero-budget path, error or empty solution.
 * {@code solverLatencyMs} is wall time of the whole solver step on every path.
 */
public record DecisionPipelineResult(
    @JsonProperty("decision")       StrategyDecision decision,
    @JsonProperty("solverResult")   GtoSolution solverResult,
    @JsonProperty("advisorResult")  AggregatedAdvisorOutput advisorResult,
    @JsonProperty("solverTimedOut") boolean solverTimedOut,
    @JsonProperty("solverLatencyMs") long solverLatencyMs
) {}
