package com.paddleframe.core.plugin;

import java.util.Optional;

/**
 * 插件调用结果
 *
 * @param success        是否成功
 * @param executionTime  实测耗时（毫秒）
 * @param error          失败原因
 * @param exceededBudget 耗时是否超过帧预算（仅告警）
 */
public record PluginExecutionResult(boolean success,
                                    double executionTime,
                                    Throwable error,
                                    boolean exceededBudget) {

    public static PluginExecutionResult success(double executionTime, boolean exceededBudget) {
        return new PluginExecutionResult(true, executionTime, null, exceededBudget);
    }

    public static PluginExecutionResult failure(double executionTime, Throwable error, boolean exceededBudget) {
        return new PluginExecutionResult(false, executionTime, error, exceededBudget);
    }

    /**
     * 未执行即失败（插件未激活、不支持的操作等）
     */
    public static PluginExecutionResult rejected(Throwable error) {
        return new PluginExecutionResult(false, 0, error, false);
    }

    public Optional<Throwable> findError() {
        return Optional.ofNullable(error);
    }
}
