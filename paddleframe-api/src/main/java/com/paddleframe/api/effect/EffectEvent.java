package com.paddleframe.api.effect;

/**
 * 效果生命周期通知
 */
public enum EffectEvent {
    ACTIVATE,
    UPDATE,
    DEACTIVATE,
    CONFLICT,
    STACK
}
