package com.paddleframe.core.exception;

import com.paddleframe.api.exception.PaddleFrameException;
import lombok.Getter;

import java.util.List;

/**
 * 注册时依赖尚未注册
 */
@Getter
public class MissingDependencyException extends PaddleFrameException {

    private final String pluginName;
    private final List<String> missingDependencies;

    public MissingDependencyException(String pluginName, List<String> missingDependencies) {
        super("Plugin " + pluginName + " missing dependencies: " + String.join(", ", missingDependencies));
        this.pluginName = pluginName;
        this.missingDependencies = List.copyOf(missingDependencies);
    }
}
