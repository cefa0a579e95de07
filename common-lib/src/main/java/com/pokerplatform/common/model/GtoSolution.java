package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable solver output keyed by {@link Action#key()} in solver order.
 */
public record GtoSolution(
    @JsonProperty("actions")        Map<String, ActionSolutionEntry> actions,
    @JsonProperty("exploitability") double exploitability,
    @JsonProperty("computeTimeMs")  long computeTimeMs,
    @JsonProperty("source")         SolutionSource source
) {
    public GtoSolution {
        actions = actions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public static GtoSolution of(List<ActionSolutionEntry> entries, double exploitability,
                                 long computeTimeMs, SolutionSource source) {
        Map<String, ActionSolutionEntry> byKey = new LinkedHashMap<>();
        for (ActionSolutionEntry entry : entries) {
            byKey.put(entry.action().key(), entry);
        }
        return new GtoSolution(byKey, exploitability, computeTimeMs, source);
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }
}
