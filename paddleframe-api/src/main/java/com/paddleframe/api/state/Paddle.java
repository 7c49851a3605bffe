package com.paddleframe.api.state;

public interface Paddle {

    double getWidth();

    double getHeight();

    void resize(double width, double height);

    boolean isActive();
}
