package com.paddleframe.api.effect;

import com.paddleframe.api.context.EffectContext;

/**
 * 效果事件监听器
 * 由宿主注入（通常桥接到游戏的事件总线），Core 不负责创建
 *
 * @author PaddleFrame
 */
@FunctionalInterface
public interface EffectEventListener {

    void onEffectEvent(EffectEvent event, EffectPlugin source, EffectContext context);
}
