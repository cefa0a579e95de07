package com.pokerplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TablePositions(
    @JsonProperty("hero")       Position hero,
    @JsonProperty("button")     Position button,
    @JsonProperty("smallBlind") Position smallBlind,
    @JsonProperty("bigBlind")   Position bigBlind
) {}
