package com.paddleframe.api.state;

public interface Block {

    int getHitPoints();

    boolean isDestroyed();
}
