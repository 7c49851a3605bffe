package com.paddleframe.core.plugin;

import com.paddleframe.api.context.ExecutionContext;
import com.paddleframe.api.plugin.FrameAware;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 参与逐帧执行的测试插件
 */
public class MockFramePlugin extends MockGamePlugin implements FrameAware {

    volatile long frameDelayMs;
    volatile Exception frameFailure;
    volatile ExecutionContext lastContext;
    final AtomicInteger frames = new AtomicInteger();

    public MockFramePlugin(String name, List<String> journal, String... dependencies) {
        super(name, journal, dependencies);
    }

    @Override
    public void onFrame(ExecutionContext context) throws Exception {
        frames.incrementAndGet();
        lastContext = context;
        if (frameDelayMs > 0) {
            Thread.sleep(frameDelayMs);
        }
        if (frameFailure != null) {
            throw frameFailure;
        }
    }
}
