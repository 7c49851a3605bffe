package com.paddleframe.core.plugin;

import java.util.List;
import java.util.Optional;

/**
 * 插件元数据快照（只读，时间单位毫秒）
 */
public record PluginMetadata(String name,
                             String version,
                             String description,
                             List<String> dependencies,
                             PluginStatus status,
                             double initTime,
                             double lastExecutionTime,
                             double totalExecutionTime,
                             long executionCount,
                             int errorCount,
                             Throwable lastError) {

    public Optional<Throwable> findLastError() {
        return Optional.ofNullable(lastError);
    }
}
