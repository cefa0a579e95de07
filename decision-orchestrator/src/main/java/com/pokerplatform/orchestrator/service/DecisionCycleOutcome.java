package com.pokerplatform.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pokerplatform.orchestrator.pipeline.DecisionPipelineResult;

import java.util.List;

/**
 * One finished decision cycle. The decision is always present; {@code actionable} tells
 * the caller whether it may be executed, and {@code blockedReason} says why not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionCycleOutcome(
    @JsonProperty("result")        DecisionPipelineResult result,
    @JsonProperty("violations")    List<String> violations,
    @JsonProperty("actionable")    boolean actionable,
    @JsonProperty("blockedReason") String blockedReason
) {
    public DecisionCycleOutcome {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }
}
