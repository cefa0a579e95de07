package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StrategyTiming(
    @JsonProperty("gtoTimeMs")       long gtoTimeMs,
    @JsonProperty("agentTimeMs")     long agentTimeMs,
    @JsonProperty("synthesisTimeMs") long synthesisTimeMs,
    @JsonProperty("totalTimeMs")     long totalTimeMs
) {}
