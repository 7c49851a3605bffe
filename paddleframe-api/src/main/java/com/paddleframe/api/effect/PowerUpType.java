package com.paddleframe.api.effect;

import lombok.Getter;

/**
 * 道具类型
 */
@Getter
public enum PowerUpType {

    MULTI_BALL("multiball"),
    PADDLE_SIZE("paddlesize"),
    BALL_SPEED("ballspeed"),
    PENETRATION("penetration"),
    MAGNET("magnet");

    private final String id;

    PowerUpType(String id) {
        this.id = id;
    }

    public static PowerUpType fromId(String id) {
        for (PowerUpType type : values()) {
            if (type.id.equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown power-up type: " + id);
    }
}
