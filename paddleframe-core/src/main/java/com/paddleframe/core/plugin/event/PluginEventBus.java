package com.paddleframe.core.plugin.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * PluginManager 生命周期事件的同步分发器
 * <p>
 * 订阅可以按事件类型、按插件名或两者组合过滤；也可以注册 {@link PluginLifecycleListener}
 * 接收全部事件。监听器在发布线程上按订阅顺序执行，单个监听器失败只记录日志。
 */
@Slf4j
public class PluginEventBus {

    private final String managerName;

    private final List<Route<?>> routes = new CopyOnWriteArrayList<>();

    // 每个插件已发布的事件数，便于诊断
    private final Map<String, AtomicLong> publishedByPlugin = new ConcurrentHashMap<>();

    public PluginEventBus(String managerName) {
        this.managerName = managerName;
    }

    public <E extends PluginEvent> Subscription subscribe(Class<E> eventType, Consumer<? super E> handler) {
        return addRoute(new Route<>(eventType, null, handler));
    }

    /**
     * 只接收指定插件的某类事件
     */
    public <E extends PluginEvent> Subscription subscribe(String pluginName,
                                                          Class<E> eventType,
                                                          Consumer<? super E> handler) {
        if (pluginName == null || pluginName.isBlank()) {
            throw new IllegalArgumentException("Plugin name cannot be blank");
        }
        return addRoute(new Route<>(eventType, pluginName, handler));
    }

    public Subscription subscribeAll(Consumer<PluginEvent> handler) {
        return addRoute(new Route<>(PluginEvent.class, null, handler));
    }

    public Subscription subscribe(PluginLifecycleListener listener) {
        return addRoute(new Route<>(PluginEvent.class, null, listener::dispatch));
    }

    public void publish(PluginEvent event) {
        publishedByPlugin.computeIfAbsent(event.pluginName(), k -> new AtomicLong()).incrementAndGet();

        int delivered = 0;
        for (Route<?> route : routes) {
            if (!route.matches(event)) {
                continue;
            }
            try {
                route.deliver(event);
                delivered++;
            } catch (Exception e) {
                log.error("[{}] Listener for {} failed on {}: {}",
                        managerName, event.pluginName(), event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        log.debug("[{}] {} for plugin {} delivered to {} listener(s)",
                managerName, event.getClass().getSimpleName(), event.pluginName(), delivered);
    }

    /**
     * 某插件已发布的事件数
     */
    public long getPublishedCount(String pluginName) {
        AtomicLong count = publishedByPlugin.get(pluginName);
        return count != null ? count.get() : 0;
    }

    public int getSubscriptionCount() {
        return routes.size();
    }

    public void clear() {
        routes.clear();
        publishedByPlugin.clear();
    }

    private Subscription addRoute(Route<?> route) {
        routes.add(route);
        log.debug("[{}] Subscribed to {}{}", managerName, route.eventType.getSimpleName(),
                route.pluginName != null ? " of " + route.pluginName : "");
        return () -> routes.remove(route);
    }

    /**
     * 订阅句柄
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    // 事件类型 + 可选插件名 → 处理器；投递时用 Class.cast 保证类型
    private static final class Route<E extends PluginEvent> {

        private final Class<E> eventType;
        private final String pluginName;
        private final Consumer<? super E> handler;

        Route(Class<E> eventType, String pluginName, Consumer<? super E> handler) {
            this.eventType = eventType;
            this.pluginName = pluginName;
            this.handler = handler;
        }

        boolean matches(PluginEvent event) {
            return eventType.isInstance(event)
                    && (pluginName == null || pluginName.equals(event.pluginName()));
        }

        void deliver(PluginEvent event) {
            handler.accept(eventType.cast(event));
        }
    }
}
