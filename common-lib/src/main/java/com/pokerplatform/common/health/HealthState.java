package com.pokerplatform.common.health;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Component health, declared in increasing severity so ordinal order is aggregation order.
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    FAILED;

    public HealthState worst(HealthState other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
