package com.paddleframe.api.effect;

/**
 * 道具展示元数据：静态描述 + 当前效果描述符
 *
 * @param duration 持续时间（毫秒）
 */
public record PowerUpMetadata(PowerUpType type,
                              String name,
                              String description,
                              String icon,
                              String color,
                              Rarity rarity,
                              long duration,
                              PowerUpEffect effect) {
}
