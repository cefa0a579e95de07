package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A concrete action for one seat on one street.
 *
 * <p>{@code amount} is only meaningful for {@link ActionType#RAISE} (and an explicit call
 * size when the parser reports one); it is {@code null} otherwise.
 */
public record Action(
    @JsonProperty("type")     ActionType type,
    @JsonProperty("position") Position position,
    @JsonProperty("street")   Street street,
    @JsonProperty("amount")   Double amount
) {
    public static Action of(ActionType type, Position position, Street street) {
        return new Action(type, position, street, null);
    }

    /**
     * Stable key used to index solver entries, e.g. {@code "flop:BTN:raise:10.00"}.
     */
    public String key() {
        String base = (street != null ? street.wireName() : "unknown") + ":"
            + (position != null ? position.name() : "unknown") + ":"
            + (type != null ? type.wireName() : "unknown");
        return amount == null ? base : base + ":" + String.format("%.2f", amount);
    }
}
