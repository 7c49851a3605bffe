package com.paddleframe.core.exception;

import com.paddleframe.api.exception.PaddleFrameException;
import lombok.Getter;

/**
 * init/destroy 超过 executionTimeout
 */
@Getter
public class PluginTimeoutException extends PaddleFrameException {

    private final String pluginName;
    private final String phase;
    private final long timeoutMs;

    public PluginTimeoutException(String pluginName, String phase, long timeoutMs) {
        super("Plugin " + pluginName + " " + phase + " timeout (" + timeoutMs + "ms)");
        this.pluginName = pluginName;
        this.phase = phase;
        this.timeoutMs = timeoutMs;
    }
}
