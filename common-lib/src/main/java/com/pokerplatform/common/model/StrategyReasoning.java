package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Reasoning trace attached to a {@link StrategyDecision}. Distributions are keyed by
 * {@link Action#key()}; {@code divergence} is the GTO/advisor disagreement in percentage
 * points and {@code fallbackReason} is non-null whenever blending fell back.
 */
public record StrategyReasoning(
    @JsonProperty("gtoRecommendation")   Map<String, Double> gtoRecommendation,
    @JsonProperty("agentRecommendation") Map<String, Double> agentRecommendation,
    @JsonProperty("blendedDistribution") Map<String, Double> blendedDistribution,
    @JsonProperty("alpha")               double alpha,
    @JsonProperty("divergence")          double divergence,
    @JsonProperty("riskCheckPassed")     boolean riskCheckPassed,
    @JsonProperty("fallbackReason")      String fallbackReason
) {
    public StrategyReasoning {
        gtoRecommendation   = gtoRecommendation == null ? Map.of() : Map.copyOf(gtoRecommendation);
        agentRecommendation = agentRecommendation == null ? Map.of() : Map.copyOf(agentRecommendation);
        blendedDistribution = blendedDistribution == null ? Map.of() : Map.copyOf(blendedDistribution);
    }
}
