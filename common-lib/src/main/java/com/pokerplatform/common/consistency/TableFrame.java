package com.pokerplatform.common.consistency;

import com.pokerplatform.common.model.GameState;
import com.pokerplatform.common.model.Position;
import com.pokerplatform.common.model.Street;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The slice of a parsed world state the consistency checker compares between frames.
 */
public record TableFrame(
    String handId,
    Map<Position, Double> stacks,
    double pot,
    Street street,
    double confidence,
    List<String> parseErrors
) {
    public TableFrame {
        Map<Position, Double> ordered = new EnumMap<>(Position.class);
        if (stacks != null) {
            ordered.putAll(stacks);
        }
        stacks = Collections.unmodifiableMap(ordered);
        parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);
    }

    public static TableFrame of(String handId, Map<Position, Double> stacks, double pot) {
        return new TableFrame(handId, stacks, pot, null, 1.0, List.of());
    }

    public static TableFrame from(GameState state) {
        return new TableFrame(state.handId(), state.stacks(), state.pot(), state.street(),
            state.confidence(), state.parseErrors());
    }

    public double totalStacks() {
        return stacks.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
