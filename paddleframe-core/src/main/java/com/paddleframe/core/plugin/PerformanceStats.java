package com.paddleframe.core.plugin;

import jakarta.annotation.Nonnull;

import java.util.List;

/**
 * 管理器性能统计（毫秒）
 *
 * @param averageExecutionTime 总耗时 / 激活插件数
 */
public record PerformanceStats(int totalPlugins,
                               int activePlugins,
                               double averageExecutionTime,
                               double totalExecutionTime,
                               List<String> pluginsExceedingBudget) {

    @Override
    @Nonnull
    public String toString() {
        return String.format("PerformanceStats{total=%d, active=%d, avg=%.3fms, sum=%.3fms, overBudget=%s}",
                totalPlugins, activePlugins, averageExecutionTime, totalExecutionTime, pluginsExceedingBudget);
    }
}
