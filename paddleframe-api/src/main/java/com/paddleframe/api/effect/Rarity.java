package com.paddleframe.api.effect;

public enum Rarity {
    COMMON,
    RARE,
    EPIC
}
