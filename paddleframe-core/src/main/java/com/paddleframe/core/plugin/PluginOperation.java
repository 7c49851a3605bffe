package com.paddleframe.core.plugin;

import com.paddleframe.api.context.EffectContext;
import com.paddleframe.api.context.ExecutionContext;
import com.paddleframe.api.effect.EffectPlugin;
import com.paddleframe.api.plugin.FrameAware;
import com.paddleframe.api.plugin.GamePlugin;

import java.util.function.Predicate;

/**
 * executePlugin 支持的操作（封闭集合）
 * <p>
 * 每个操作绑定一个能力判断和一个类型化的调用，取代按方法名反射分派。
 * init/destroy 只能经由 initializePlugin/destroyPlugin 调用。
 */
public enum PluginOperation {

    /**
     * 逐帧回调（{@link FrameAware}）
     */
    FRAME(ExecutionContext.class, false,
            plugin -> plugin instanceof FrameAware,
            (plugin, context) -> {
                ((FrameAware) plugin).onFrame(context);
                return null;
            }),

    APPLY_EFFECT(EffectContext.class, true,
            plugin -> plugin instanceof EffectPlugin,
            (plugin, context) -> ((EffectPlugin) plugin).applyEffect((EffectContext) context)),

    REMOVE_EFFECT(EffectContext.class, true,
            plugin -> plugin instanceof EffectPlugin,
            (plugin, context) -> ((EffectPlugin) plugin).removeEffect((EffectContext) context)),

    UPDATE_EFFECT(EffectContext.class, true,
            plugin -> plugin instanceof EffectPlugin,
            (plugin, context) -> ((EffectPlugin) plugin).updateEffect((EffectContext) context));

    private final Class<? extends ExecutionContext> contextType;
    private final boolean contextRequired;
    private final Predicate<GamePlugin> capability;
    private final Invoker invoker;

    PluginOperation(Class<? extends ExecutionContext> contextType,
                    boolean contextRequired,
                    Predicate<GamePlugin> capability,
                    Invoker invoker) {
        this.contextType = contextType;
        this.contextRequired = contextRequired;
        this.capability = capability;
        this.invoker = invoker;
    }

    public boolean isSupportedBy(GamePlugin plugin) {
        return capability.test(plugin);
    }

    public boolean accepts(ExecutionContext context) {
        if (context == null) {
            return !contextRequired;
        }
        return contextType.isInstance(context);
    }

    public Class<? extends ExecutionContext> getContextType() {
        return contextType;
    }

    Object invoke(GamePlugin plugin, ExecutionContext context) throws Exception {
        return invoker.invoke(plugin, context);
    }

    @FunctionalInterface
    interface Invoker {
        Object invoke(GamePlugin plugin, ExecutionContext context) throws Exception;
    }
}
