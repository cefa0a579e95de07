package com.pokerplatform.common.model;

public enum Position {
    BTN,
    SB,
    BB,
    UTG,
    MP,
    CO
}
