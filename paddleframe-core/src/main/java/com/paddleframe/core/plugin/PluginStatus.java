package com.paddleframe.core.plugin;

/**
 * 插件状态
 * <pre>
 * REGISTERED → INITIALIZING → ACTIVE → DESTROYED
 *      任一阶段失败 → ERROR（可重试初始化或清理销毁）
 *      DESTROYED → INITIALIZING（会话重启）
 * </pre>
 */
public enum PluginStatus {

    REGISTERED,
    INITIALIZING,
    ACTIVE,
    ERROR,
    DESTROYED;

    public boolean canTransitionTo(PluginStatus target) {
        return switch (this) {
            case REGISTERED -> target == INITIALIZING || target == ERROR;
            case INITIALIZING -> target == ACTIVE || target == ERROR;
            case ACTIVE -> target == DESTROYED || target == ERROR;
            case ERROR -> target == INITIALIZING || target == DESTROYED || target == ERROR;
            case DESTROYED -> target == INITIALIZING;
        };
    }
}
