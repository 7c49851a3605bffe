package com.paddleframe.api.effect;

import com.paddleframe.api.context.EffectContext;
import com.paddleframe.api.plugin.GamePlugin;

/**
 * 效果插件（道具）契约
 * <p>
 * 所有效果方法只在插件 init 成功之后有效；之前调用返回失败结果，不抛异常。
 * </p>
 *
 * @author PaddleFrame
 */
public interface EffectPlugin extends GamePlugin {

    PowerUpType getPowerUpType();

    PowerUpEffect getEffect();

    /**
     * 将效果应用到游戏状态
     */
    EffectResult applyEffect(EffectContext context);

    /**
     * 从游戏状态移除效果
     */
    EffectResult removeEffect(EffectContext context);

    /**
     * 效果生效期间的逐帧更新
     */
    EffectResult updateEffect(EffectContext context);

    /**
     * 处理与另一种道具的冲突
     */
    EffectResult handleConflict(PowerUpType conflictingType, EffectContext context);

    /**
     * 按补丁回滚一次效果应用
     */
    EffectResult revert(EffectPatch patch, EffectContext context);

    PowerUpMetadata getMetadata();

    EffectPerformanceMetrics getPerformanceMetrics();
}
