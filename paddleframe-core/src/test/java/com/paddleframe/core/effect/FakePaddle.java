package com.paddleframe.core.effect;

import com.paddleframe.api.state.Paddle;

class FakePaddle implements Paddle {

    private double width;
    private double height;

    FakePaddle(double width, double height) {
        this.width = width;
        this.height = height;
    }

    @Override
    public double getWidth() {
        return width;
    }

    @Override
    public double getHeight() {
        return height;
    }

    @Override
    public void resize(double width, double height) {
        this.width = width;
        this.height = height;
    }

    @Override
    public boolean isActive() {
        return true;
    }
}
