package com.paddleframe.core.exception;

import com.paddleframe.api.exception.PaddleFrameException;
import lombok.Getter;

import java.util.List;

/**
 * 循环依赖
 * <p>
 * 唯一会抛给调用方的致命错误：不存在合法的线性初始化顺序。
 * </p>
 */
@Getter
public class CircularDependencyException extends PaddleFrameException {

    // 环路径，首尾为同一插件
    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}
