package com.pokerplatform.common.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record PanicStopReason(
    @JsonProperty("type")        PanicStopType type,
    @JsonProperty("detail")      String detail,
    @JsonProperty("triggeredAt") Instant triggeredAt
) {}
