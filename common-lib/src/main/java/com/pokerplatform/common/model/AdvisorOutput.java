package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single advisor's vote inside an {@link AggregatedAdvisorOutput}.
 */
public record AdvisorOutput(
    @JsonProperty("advisorId")  String advisorId,
    @JsonProperty("personaId")  String personaId,
    @JsonProperty("action")     ActionType action,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning")  String reasoning,
    @JsonProperty("latencyMs")  long latencyMs
) {}
