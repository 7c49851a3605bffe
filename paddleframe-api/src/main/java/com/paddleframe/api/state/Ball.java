package com.paddleframe.api.state;

public interface Ball {

    double getVelocityX();

    double getVelocityY();

    void setVelocity(double velocityX, double velocityY);

    boolean isActive();
}
