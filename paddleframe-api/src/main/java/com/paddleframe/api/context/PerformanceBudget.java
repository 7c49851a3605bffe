package com.paddleframe.api.context;

import lombok.Getter;

/**
 * 单次调用的性能预算槽位
 * <p>
 * 由 PluginManager 在调用插件方法之前填充；插件可以据此判断剩余时间。
 * </p>
 */
@Getter
public class PerformanceBudget {

    // System.nanoTime() 时间戳
    private long startTime;

    // 毫秒，<= 0 表示不限制
    private double maxExecutionTime;

    private boolean stamped;

    /**
     * 写入开始时间与预算
     */
    public void stamp(long startTime, double maxExecutionTime) {
        this.startTime = startTime;
        this.maxExecutionTime = maxExecutionTime;
        this.stamped = true;
    }

    /**
     * 自开始时间起已消耗的毫秒数，未填充时为 0
     */
    public double elapsedMillis() {
        if (!stamped) {
            return 0;
        }
        return (System.nanoTime() - startTime) / 1_000_000.0;
    }

    /**
     * 剩余毫秒数，未限制时为 {@link Double#POSITIVE_INFINITY}
     */
    public double remainingMillis() {
        if (!stamped || maxExecutionTime <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return maxExecutionTime - elapsedMillis();
    }

    public boolean isExceeded() {
        return stamped && maxExecutionTime > 0 && elapsedMillis() > maxExecutionTime;
    }
}
