package com.paddleframe.api.state;

import java.util.List;

/**
 * 插件可见的游戏状态
 * 只暴露插件真正需要的实体集合，实体由宿主持有
 *
 * @author PaddleFrame
 */
public interface GameState {

    List<Ball> getBalls();

    Paddle getPaddle();

    List<Block> getBlocks();

    List<ActivePowerUp> getActivePowerUps();
}
