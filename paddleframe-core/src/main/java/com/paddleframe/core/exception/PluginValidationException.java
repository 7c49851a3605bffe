package com.paddleframe.core.exception;

import com.paddleframe.api.exception.PaddleFrameException;

/**
 * 插件结构不合法（名称/版本为空等）
 */
public class PluginValidationException extends PaddleFrameException {

    public PluginValidationException(String message) {
        super(message);
    }
}
