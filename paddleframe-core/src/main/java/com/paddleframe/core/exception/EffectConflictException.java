package com.paddleframe.core.exception;

import com.paddleframe.api.effect.PowerUpType;
import com.paddleframe.api.exception.PaddleFrameException;
import lombok.Getter;

@Getter
public class EffectConflictException extends PaddleFrameException {

    private final String pluginName;
    private final PowerUpType powerUpType;

    public EffectConflictException(String pluginName, PowerUpType powerUpType) {
        super("Plugin " + pluginName + " conflicts with an active " + powerUpType.getId() + " effect");
        this.pluginName = pluginName;
        this.powerUpType = powerUpType;
    }
}
