package com.paddleframe.core.exception;

import com.paddleframe.api.exception.PaddleFrameException;

public class EffectNotInitializedException extends PaddleFrameException {

    public EffectNotInitializedException(String pluginName) {
        super("Plugin " + pluginName + " not initialized");
    }
}
