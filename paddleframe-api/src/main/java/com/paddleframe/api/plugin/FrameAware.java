package com.paddleframe.api.plugin;

import com.paddleframe.api.context.ExecutionContext;

/**
 * 参与逐帧执行的插件能力
 * <p>
 * 实现必须同步返回：预算检查发生在调用结束之后。
 * </p>
 *
 * @author PaddleFrame
 */
public interface FrameAware {

    /**
     * 每帧回调
     *
     * @param context 执行上下文，可能为 null（宿主未提供时）
     */
    void onFrame(ExecutionContext context) throws Exception;
}
