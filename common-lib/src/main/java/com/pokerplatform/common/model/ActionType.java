package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four action classes a hero can take. Bet sizing lives on {@link Action#amount()}.
 */
public enum ActionType {
    FOLD,
    CHECK,
    CALL,
    RAISE;

    /** True for the actions that put no further chips at risk beyond a call. */
    public boolean isPassive() {
        return this == CHECK || this == CALL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
