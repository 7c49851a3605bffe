package com.paddleframe.core.exception;

import com.paddleframe.api.exception.PaddleFrameException;
import lombok.Getter;

@Getter
public class DuplicatePluginException extends PaddleFrameException {

    private final String pluginName;

    public DuplicatePluginException(String pluginName) {
        super("Plugin " + pluginName + " is already registered");
        this.pluginName = pluginName;
    }
}
