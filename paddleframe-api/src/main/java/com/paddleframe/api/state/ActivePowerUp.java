package com.paddleframe.api.state;

import com.paddleframe.api.effect.PowerUpType;

/**
 * 正在生效的道具
 */
public interface ActivePowerUp {

    String getId();

    PowerUpType getType();

    /**
     * 剩余时长（毫秒）
     */
    long getRemainingTime();
}
