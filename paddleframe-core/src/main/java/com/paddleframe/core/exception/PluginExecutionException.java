package com.paddleframe.core.exception;

import com.paddleframe.api.exception.PaddleFrameException;

/**
 * 插件方法执行失败
 */
public class PluginExecutionException extends PaddleFrameException {

    public PluginExecutionException(String message) {
        super(message);
    }

    public PluginExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
