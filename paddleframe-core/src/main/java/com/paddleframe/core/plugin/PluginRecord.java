package com.paddleframe.core.plugin;

import com.paddleframe.api.plugin.GamePlugin;
import lombok.Getter;

import java.util.List;

/**
 * 插件注册记录：由 PluginManager 独占持有和修改
 */
@Getter
final class PluginRecord {

    private final GamePlugin plugin;

    private PluginStatus status = PluginStatus.REGISTERED;

    private double initTime;
    private double lastExecutionTime;
    private double totalExecutionTime;
    private long executionCount;
    private int errorCount;
    private Throwable lastError;

    PluginRecord(GamePlugin plugin) {
        this.plugin = plugin;
    }

    String getName() {
        return plugin.getName();
    }

    void transitionTo(PluginStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Plugin " + getName() + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    void markActive(double initTime) {
        transitionTo(PluginStatus.ACTIVE);
        this.initTime = initTime;
    }

    void markFailed(Throwable error) {
        transitionTo(PluginStatus.ERROR);
        recordError(error);
    }

    void recordError(Throwable error) {
        this.errorCount++;
        this.lastError = error;
    }

    void recordExecution(double executionTime) {
        this.lastExecutionTime = executionTime;
        this.totalExecutionTime += executionTime;
        this.executionCount++;
    }

    PluginMetadata snapshot() {
        List<String> dependencies = plugin.getDependencies();
        return new PluginMetadata(
                plugin.getName(),
                plugin.getVersion(),
                plugin.getDescription(),
                dependencies == null ? List.of() : List.copyOf(dependencies),
                status,
                initTime,
                lastExecutionTime,
                totalExecutionTime,
                executionCount,
                errorCount,
                lastError
        );
    }
}
