package com.paddleframe.core.plugin;

import com.paddleframe.core.config.PluginManagerConfig;
import com.paddleframe.core.exception.PluginExecutionException;
import com.paddleframe.core.exception.PluginTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 生命周期执行器
 * 职责：在独立线程上执行 init/destroy，并以 executionTimeout 限时等待
 * <p>
 * 超时后管理器只是停止等待，钩子本身不会被取消（除非开启 interruptOnTimeout，
 * 此时向执行线程发送中断信号，由插件自行响应）。因此一个慢 init 可能在已被判定失败之后
 * 才完成并修改外部状态。
 */
@Slf4j
public class LifecycleExecutor {

    private final ExecutorService executor;
    private final long timeoutMs;
    private final boolean interruptOnTimeout;

    public LifecycleExecutor(ExecutorService executor, long timeoutMs, boolean interruptOnTimeout) {
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        this.interruptOnTimeout = interruptOnTimeout;
    }

    public LifecycleExecutor(ExecutorService executor, PluginManagerConfig config) {
        this(executor, config.getExecutionTimeout(), config.isInterruptOnTimeout());
    }

    /**
     * 执行生命周期钩子
     *
     * @return 实际耗时（毫秒）
     * @throws PluginTimeoutException   超时
     * @throws PluginExecutionException 钩子抛出异常或无法调度
     */
    public double execute(String pluginName, LifecyclePhase phase, LifecycleHook hook) {
        long startTime = System.nanoTime();

        Future<?> future;
        try {
            future = executor.submit(() -> {
                hook.run();
                return null;
            });
        } catch (RejectedExecutionException e) {
            throw new PluginExecutionException(
                    "Plugin " + pluginName + " " + phase.getDescription() + " rejected: executor unavailable", e);
        }

        waitForCompletion(future, pluginName, phase);
        return (System.nanoTime() - startTime) / 1_000_000.0;
    }

    private void waitForCompletion(Future<?> future, String pluginName, LifecyclePhase phase) {
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (interruptOnTimeout) {
                future.cancel(true);
            }
            log.error("[{}] {} timeout ({}ms), interrupt={}",
                    pluginName, phase.getDescription(), timeoutMs, interruptOnTimeout);
            throw new PluginTimeoutException(pluginName, phase.getDescription(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PluginExecutionException(
                    "Plugin " + pluginName + " " + phase.getDescription() + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginExecutionException(
                    "Plugin " + pluginName + " " + phase.getDescription() + " interrupted", e);
        }
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * 生命周期钩子
     */
    @FunctionalInterface
    public interface LifecycleHook {
        void run() throws Exception;
    }
}
