package com.paddleframe.core.effect;

import com.paddleframe.api.state.ActivePowerUp;
import com.paddleframe.api.state.Ball;
import com.paddleframe.api.state.Block;
import com.paddleframe.api.state.GameState;
import com.paddleframe.api.state.Paddle;

import java.util.ArrayList;
import java.util.List;

class FakeGameState implements GameState {

    private final Paddle paddle;
    private final List<ActivePowerUp> activePowerUps = new ArrayList<>();

    FakeGameState(Paddle paddle) {
        this.paddle = paddle;
    }

    @Override
    public List<Ball> getBalls() {
        return List.of();
    }

    @Override
    public Paddle getPaddle() {
        return paddle;
    }

    @Override
    public List<Block> getBlocks() {
        return List.of();
    }

    @Override
    public List<ActivePowerUp> getActivePowerUps() {
        return activePowerUps;
    }
}
