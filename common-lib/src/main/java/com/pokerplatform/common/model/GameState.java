package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Parsed world state for one decision tick.
 *
 * <p>{@code stacks} maps each occupied seat to its chip count as read from the table;
 * {@code confidence} is the parser's overall confidence in [0.0, 1.0] and
 * {@code parseErrors} lists any element the parser could not read for this frame.
 * Collections are never {@code null} once constructed.
 */
public record GameState(
    @JsonProperty("handId")       String handId,
    @JsonProperty("positions")    TablePositions positions,
    @JsonProperty("stacks")       Map<Position, Double> stacks,
    @JsonProperty("pot")          double pot,
    @JsonProperty("street")       Street street,
    @JsonProperty("legalActions") List<Action> legalActions,
    @JsonProperty("confidence")   double confidence,
    @JsonProperty("parseErrors")  List<String> parseErrors
) {
    public GameState {
        stacks       = stacks == null ? Map.of() : Map.copyOf(stacks);
        legalActions = legalActions == null ? List.of() : List.copyOf(legalActions);
        parseErrors  = parseErrors == null ? List.of() : List.copyOf(parseErrors);
    }

    public Position hero() {
        return positions != null ? positions.hero() : null;
    }

    public GameState withLegalActions(List<Action> actions) {
        return new GameState(handId, positions, stacks, pot, street, actions, confidence, parseErrors);
    }
}
