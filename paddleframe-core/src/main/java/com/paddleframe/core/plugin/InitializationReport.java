package com.paddleframe.core.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * initializeAll 的汇总结果
 *
 * @param outcomes 按初始化顺序排列：插件名 → 是否成功
 */
public record InitializationReport(Map<String, Boolean> outcomes) {

    public InitializationReport {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public List<String> order() {
        return List.copyOf(outcomes.keySet());
    }

    public List<String> succeeded() {
        return outcomes.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public List<String> failed() {
        return outcomes.entrySet().stream()
                .filter(e -> !e.getValue())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public boolean allSucceeded() {
        return !outcomes.containsValue(Boolean.FALSE);
    }
}
