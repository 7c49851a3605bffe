package com.paddleframe.api.context;

import com.paddleframe.api.state.GameState;
import lombok.Getter;

/**
 * 插件执行上下文：每次调用新建的值对象
 * <p>
 * 游戏状态按引用传递，Core 只负责转发，不读取也不修改。
 * </p>
 *
 * @author PaddleFrame
 */
@Getter
public class ExecutionContext {

    private final GameState gameState;

    // 帧间隔（毫秒）
    private final double deltaTime;

    // 当前时间（epoch 毫秒）
    private final long currentTime;

    private final PerformanceBudget performance = new PerformanceBudget();

    public ExecutionContext(GameState gameState, double deltaTime, long currentTime) {
        this.gameState = gameState;
        this.deltaTime = deltaTime;
        this.currentTime = currentTime;
    }

    /**
     * 以当前时间创建上下文
     */
    public static ExecutionContext of(GameState gameState, double deltaTime) {
        return new ExecutionContext(gameState, deltaTime, System.currentTimeMillis());
    }
}
