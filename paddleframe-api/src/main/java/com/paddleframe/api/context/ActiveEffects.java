package com.paddleframe.api.context;

import com.paddleframe.api.effect.PowerUpEffect;
import com.paddleframe.api.effect.PowerUpType;
import com.paddleframe.api.state.ActivePowerUp;
import com.paddleframe.api.state.GameState;

/**
 * 调用方维护的“当前生效效果”视图
 * 效果插件在应用前通过它检查冲突前置条件
 */
@FunctionalInterface
public interface ActiveEffects {

    boolean isActive(PowerUpType type);

    /**
     * 是否与当前生效的任一效果冲突
     */
    default boolean conflictsWith(PowerUpEffect effect) {
        for (PowerUpType type : effect.conflictsWith()) {
            if (isActive(type)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 基于游戏状态中的 active power-up 列表构建视图
     */
    static ActiveEffects of(GameState gameState) {
        return type -> {
            if (gameState == null || gameState.getActivePowerUps() == null) {
                return false;
            }
            for (ActivePowerUp powerUp : gameState.getActivePowerUps()) {
                if (powerUp.getType() == type) {
                    return true;
                }
            }
            return false;
        };
    }
}
