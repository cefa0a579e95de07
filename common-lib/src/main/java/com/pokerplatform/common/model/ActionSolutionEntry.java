package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One candidate in a solver solution: the action, how often the equilibrium plays it,
 * and its expected value in big blinds.
 */
public record ActionSolutionEntry(
    @JsonProperty("action")        Action action,
    @JsonProperty("frequency")     double frequency,
    @JsonProperty("expectedValue") double expectedValue
) {}
