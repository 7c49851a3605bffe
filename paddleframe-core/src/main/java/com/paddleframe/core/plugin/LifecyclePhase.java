package com.paddleframe.core.plugin;

import lombok.Getter;

@Getter
public enum LifecyclePhase {

    INIT("initialization"),
    DESTROY("destruction");

    private final String description;

    LifecyclePhase(String description) {
        this.description = description;
    }
}
