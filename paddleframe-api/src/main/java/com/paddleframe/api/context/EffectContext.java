package com.paddleframe.api.context;

import com.paddleframe.api.effect.PowerUpType;
import com.paddleframe.api.state.GameState;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 效果插件专用上下文
 * <p>
 * effectData 在一次激活的 apply/update/remove 之间共享，由插件自行读写。
 * </p>
 *
 * @author PaddleFrame
 */
@Getter
public class EffectContext extends ExecutionContext {

    private final PowerUpType powerUpType;

    private final String powerUpId;

    private final Map<String, Object> effectData = new HashMap<>();

    // 可选：调用方的生效效果注册表
    private final ActiveEffects activeEffects;

    public EffectContext(GameState gameState,
                         double deltaTime,
                         long currentTime,
                         PowerUpType powerUpType,
                         String powerUpId,
                         ActiveEffects activeEffects) {
        super(gameState, deltaTime, currentTime);
        this.powerUpType = powerUpType;
        this.powerUpId = powerUpId;
        this.activeEffects = activeEffects;
    }

    public EffectContext(GameState gameState, double deltaTime, PowerUpType powerUpType, String powerUpId) {
        this(gameState, deltaTime, System.currentTimeMillis(), powerUpType, powerUpId, null);
    }

    public Optional<ActiveEffects> findActiveEffects() {
        return Optional.ofNullable(activeEffects);
    }
}
