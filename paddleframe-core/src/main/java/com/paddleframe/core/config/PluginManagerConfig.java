package com.paddleframe.core.config;

import lombok.Builder;
import lombok.Value;

/**
 * PluginManager 配置对象
 * <p>
 * 每个管理器实例各持一份（随游戏会话创建），不存在进程级全局配置。
 * 所有字段均可选，未设置时取默认值。构建后不可变，需要调整时用 toBuilder() 派生新配置
 * 并创建新的管理器。
 */
@Value
@Builder(toBuilder = true)
public class PluginManagerConfig {

    /**
     * 是否开启性能监控（超预算告警、BudgetExceeded 事件）
     */
    @Builder.Default
    private boolean performanceMonitoring = true;

    /**
     * 单次插件调用的帧预算（毫秒）
     * <p>
     * 仅用于观测：超出只会打标记，不会中断执行
     */
    @Builder.Default
    private double maxExecutionTimePerFrame = 2.0;

    /**
     * init/destroy 超时时间（毫秒）
     */
    @Builder.Default
    private long executionTimeout = 5000;

    /**
     * 超时后是否中断生命周期线程
     * <p>
     * false: 仅停止等待，钩子继续运行至结束
     * <p>
     * true: 向执行线程发送中断信号，响应中断的插件可以提前退出
     */
    @Builder.Default
    private boolean interruptOnTimeout = false;

    /**
     * 生命周期线程名前缀
     */
    @Builder.Default
    private String lifecycleThreadPrefix = "paddleframe-lifecycle";

    public static PluginManagerConfig defaults() {
        return PluginManagerConfig.builder().build();
    }
}
