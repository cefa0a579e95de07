package com.pokerplatform.common.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PanicStopType {
    VISION_CONFIDENCE,
    RISK_LIMIT,
    MANUAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
