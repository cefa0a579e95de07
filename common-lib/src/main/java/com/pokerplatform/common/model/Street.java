package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Street {
    PREFLOP,
    FLOP,
    TURN,
    RIVER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
