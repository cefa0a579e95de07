package com.pokerplatform.common.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.Objects;

/**
 * Safe-mode latch state. {@link Active} always carries a reason, so "active without a
 * reason" cannot be expressed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SafeModeState.Inactive.class, name = "inactive"),
    @JsonSubTypes.Type(value = SafeModeState.Active.class,   name = "active")
})
public sealed interface SafeModeState permits SafeModeState.Inactive, SafeModeState.Active {

    SafeModeState INACTIVE = new Inactive();

    @JsonProperty("active")
    boolean active();

    record Inactive() implements SafeModeState {
        @Override
        @JsonProperty("active")
        public boolean active() {
            return false;
        }
    }

    record Active(
        @JsonProperty("reason")    String reason,
        @JsonProperty("enteredAt") Instant enteredAt,
        @JsonProperty("manual")    boolean manual
    ) implements SafeModeState {
        public Active {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(enteredAt, "enteredAt");
        }

        @Override
        @JsonProperty("active")
        public boolean active() {
            return true;
        }
    }
}
