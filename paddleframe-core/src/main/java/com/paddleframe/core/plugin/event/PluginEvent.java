package com.paddleframe.core.plugin.event;

/**
 * 插件管理器生命周期事件
 * 注意：这是 Core 内部事件，与游戏的 UI 事件总线无关
 */
public sealed interface PluginEvent {

    String pluginName();

    /**
     * 插件已注册
     */
    record PluginRegistered(String pluginName, String version) implements PluginEvent {
    }

    /**
     * 插件已激活（init 成功）
     */
    record PluginActivated(String pluginName, double initTimeMs) implements PluginEvent {
    }

    /**
     * 生命周期阶段失败（init/destroy 抛异常或超时）
     */
    record PluginFailed(String pluginName, String phase, Throwable error) implements PluginEvent {
    }

    /**
     * 插件已销毁
     */
    record PluginDestroyed(String pluginName) implements PluginEvent {
    }

    /**
     * 单次调用超出帧预算（仅告警）
     */
    record BudgetExceeded(String pluginName, String operation, double executionTimeMs,
                          double budgetMs) implements PluginEvent {
    }
}
