package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ensemble result handed to strategy blending.
 *
 * <ul>
 *   <li>{@code normalizedActions} — weight per action class, summing to 1.0 when any advisor voted</li>
 *   <li>{@code consensus}         — agreement score in [0.0, 1.0]</li>
 *   <li>{@code winningAction}     — highest-weighted action, {@code null} when there is no signal</li>
 *   <li>{@code budgetUsedMs}      — wall-clock time the ensemble spent</li>
 * </ul>
 */
public record AggregatedAdvisorOutput(
    @JsonProperty("outputs")               List<AdvisorOutput> outputs,
    @JsonProperty("normalizedActions")     Map<ActionType, Double> normalizedActions,
    @JsonProperty("consensus")             double consensus,
    @JsonProperty("winningAction")         ActionType winningAction,
    @JsonProperty("budgetUsedMs")          long budgetUsedMs,
    @JsonProperty("circuitBreakerTripped") boolean circuitBreakerTripped,
    @JsonProperty("notes")                 String notes,
    @JsonProperty("startedAt")             Instant startedAt,
    @JsonProperty("completedAt")           Instant completedAt
) {
    public AggregatedAdvisorOutput {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        normalizedActions = normalizedActions == null ? Map.of() : Map.copyOf(normalizedActions);
    }

    /**
     * "No signal" output: every action class weighted 0, no consensus, zero budget used.
     * Strategy blending treats it as absent advice.
     */
    public static AggregatedAdvisorOutput stub(String notes, Instant now) {
        Map<ActionType, Double> zeroed = new EnumMap<>(ActionType.class);
        for (ActionType type : ActionType.values()) {
            zeroed.put(type, 0.0);
        }
        return new AggregatedAdvisorOutput(List.of(), zeroed, 0.0, null, 0L, false, notes, now, now);
    }
}
