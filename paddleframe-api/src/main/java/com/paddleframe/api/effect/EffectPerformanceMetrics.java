package com.paddleframe.api.effect;

/**
 * 效果插件性能指标（毫秒）
 */
public record EffectPerformanceMetrics(double totalExecutionTime,
                                       double averageExecutionTime,
                                       long activations,
                                       boolean initialized) {
}
