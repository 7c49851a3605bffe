package com.paddleframe.core.plugin.event;

/**
 * 按事件类型拆分的生命周期回调，只需覆盖关心的方法
 */
public interface PluginLifecycleListener {

    default void onRegistered(PluginEvent.PluginRegistered event) {
    }

    default void onActivated(PluginEvent.PluginActivated event) {
    }

    default void onFailed(PluginEvent.PluginFailed event) {
    }

    default void onDestroyed(PluginEvent.PluginDestroyed event) {
    }

    default void onBudgetExceeded(PluginEvent.BudgetExceeded event) {
    }

    /**
     * 分派到对应的回调
     */
    default void dispatch(PluginEvent event) {
        if (event instanceof PluginEvent.PluginRegistered registered) {
            onRegistered(registered);
        } else if (event instanceof PluginEvent.PluginActivated activated) {
            onActivated(activated);
        } else if (event instanceof PluginEvent.PluginFailed failed) {
            onFailed(failed);
        } else if (event instanceof PluginEvent.PluginDestroyed destroyed) {
            onDestroyed(destroyed);
        } else if (event instanceof PluginEvent.BudgetExceeded exceeded) {
            onBudgetExceeded(exceeded);
        }
    }
}
