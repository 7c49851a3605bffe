package com.paddleframe.core.plugin;

import com.paddleframe.api.context.ExecutionContext;
import com.paddleframe.api.effect.EffectResult;
import com.paddleframe.api.exception.PaddleFrameException;
import com.paddleframe.api.plugin.GamePlugin;
import com.paddleframe.core.config.PluginManagerConfig;
import com.paddleframe.core.exception.CircularDependencyException;
import com.paddleframe.core.exception.DuplicatePluginException;
import com.paddleframe.core.exception.MissingDependencyException;
import com.paddleframe.core.exception.PluginExecutionException;
import com.paddleframe.core.exception.PluginValidationException;
import com.paddleframe.core.plugin.event.PluginEvent;
import com.paddleframe.core.plugin.event.PluginEventBus;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 插件管理器
 * 职责：
 * 1. 插件注册与依赖校验 (Register)
 * 2. 按依赖顺序初始化/逆序销毁，带超时 (Lifecycle)
 * 3. 带帧预算的插件调用与故障隔离 (Execute)
 * 4. 性能统计 (Stats)
 * <p>
 * 每个游戏会话持有自己的实例。注册表只在宿主线程上读写，单个插件的失败
 * 一律转换为返回值，唯一抛给调用方的是 initializeAll 中的循环依赖。
 */
@Slf4j
public class PluginManager {

    @Getter
    private final PluginManagerConfig config;

    // 插件注册表：Key=插件名，按注册顺序排列
    private final Map<String, PluginRecord> plugins = new LinkedHashMap<>();

    // 激活顺序（init 成功的先后），依赖图失效时用于逆序销毁
    private final List<String> activationOrder = new ArrayList<>();

    // 生命周期线程池：超时的钩子会继续占用线程，因此使用可伸缩线程池
    private final ExecutorService lifecyclePool;

    private final LifecycleExecutor lifecycleExecutor;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final AtomicInteger threadNumber = new AtomicInteger(1);

    @Setter
    private PluginEventBus eventBus; // 可选，用于发布生命周期事件

    public PluginManager() {
        this(PluginManagerConfig.defaults());
    }

    public PluginManager(PluginManagerConfig config) {
        this.config = config != null ? config : PluginManagerConfig.defaults();
        String prefix = this.config.getLifecycleThreadPrefix();
        this.lifecyclePool = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
            // 守护线程，超时未结束的钩子不阻止 JVM 退出
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Lifecycle thread {} failed: {}", t.getName(), e.getMessage()));
            return thread;
        });
        this.lifecycleExecutor = new LifecycleExecutor(lifecyclePool, this.config);
    }

    // ==================== 注册 ====================

    /**
     * 注册插件
     * <p>
     * 依次校验：结构 → 重名 → 依赖已注册 → 不形成环。任一失败返回 false，注册表保持不变。
     */
    public boolean register(GamePlugin plugin) {
        String name = null;
        try {
            validate(plugin);
            name = plugin.getName();
            if (shutdown.get()) {
                throw new PluginValidationException("Plugin manager is shutdown");
            }

            if (plugins.containsKey(name)) {
                throw new DuplicatePluginException(name);
            }

            List<String> missing = dependenciesOf(plugin).stream()
                    .filter(dependency -> !plugins.containsKey(dependency))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                throw new MissingDependencyException(name, missing);
            }

            // 提前检测：依赖列表可变时，新插件可能闭合一个环；其他位置已有的环留给 initializeAll 报告
            String candidate = name;
            Optional<List<String>> cycle = DependencyResolver.findCycleThrough(candidate,
                    pluginName -> candidate.equals(pluginName) ? plugin : registeredPlugin(pluginName),
                    this::dependenciesOf);
            if (cycle.isPresent()) {
                throw new CircularDependencyException(cycle.get());
            }

            plugins.put(name, new PluginRecord(plugin));
            log.info("Plugin {} v{} registered successfully", name, plugin.getVersion());
            publish(new PluginEvent.PluginRegistered(name, plugin.getVersion()));
            return true;
        } catch (PaddleFrameException e) {
            log.error("Failed to register plugin {}: {}", name, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to register plugin {}", name, e);
            return false;
        }
    }

    /**
     * 注销插件
     * <p>
     * 仅限未激活的插件，且没有其他已注册插件依赖它。
     */
    public boolean unregister(String name) {
        PluginRecord record = plugins.get(name);
        if (record == null) {
            log.warn("Plugin {} not found", name);
            return false;
        }

        PluginStatus status = record.getStatus();
        if (status == PluginStatus.ACTIVE || status == PluginStatus.INITIALIZING) {
            log.warn("[{}] Cannot unregister while {}, destroy it first", name, status);
            return false;
        }

        List<String> dependents = plugins.values().stream()
                .filter(other -> other != record)
                .filter(other -> dependenciesOf(other.getPlugin()).contains(name))
                .map(PluginRecord::getName)
                .collect(Collectors.toList());
        if (!dependents.isEmpty()) {
            log.warn("[{}] Cannot unregister, required by: {}", name, String.join(", ", dependents));
            return false;
        }

        plugins.remove(name);
        activationOrder.remove(name);
        log.info("Plugin {} unregistered", name);
        return true;
    }

    // ==================== 初始化 ====================

    /**
     * 初始化单个插件（限时）
     */
    public boolean initializePlugin(String name) {
        PluginRecord record = plugins.get(name);
        if (record == null) {
            log.error("Plugin {} not found", name);
            return false;
        }
        if (shutdown.get()) {
            log.warn("[{}] Plugin manager is shutdown, skipping initialization", name);
            return false;
        }

        switch (record.getStatus()) {
            case ACTIVE -> {
                log.debug("[{}] Already active", name);
                return true;
            }
            case INITIALIZING -> {
                log.warn("[{}] Initialization already in progress", name);
                return false;
            }
            default -> {
                // REGISTERED / ERROR / DESTROYED 均可初始化
            }
        }

        record.transitionTo(PluginStatus.INITIALIZING);
        GamePlugin plugin = record.getPlugin();

        try {
            double initTime = lifecycleExecutor.execute(name, LifecyclePhase.INIT, plugin::init);
            record.markActive(initTime);
            activationOrder.remove(name);
            activationOrder.add(name);

            log.info("Plugin {} initialized in {}ms", name, String.format("%.2f", initTime));
            publish(new PluginEvent.PluginActivated(name, initTime));
            return true;
        } catch (PaddleFrameException e) {
            record.markFailed(e);
            log.error("Failed to initialize plugin {}: {}", name, e.getMessage(), e.getCause());
            publish(new PluginEvent.PluginFailed(name, LifecyclePhase.INIT.getDescription(), e));
            return false;
        }
    }

    /**
     * 按依赖顺序初始化全部插件
     * <p>
     * 先解析顺序：存在环时在任何 init 之前整体失败。之后逐个初始化，单个失败不影响其余插件。
     *
     * @throws CircularDependencyException 依赖图存在环
     */
    public InitializationReport initializeAll() {
        List<String> order;
        try {
            order = resolveOrder();
        } catch (CircularDependencyException e) {
            log.error("Plugin initialization aborted: {}", e.getMessage());
            throw e;
        }

        Map<String, Boolean> outcomes = new LinkedHashMap<>();
        for (String name : order) {
            outcomes.put(name, initializePlugin(name));
        }

        InitializationReport report = new InitializationReport(outcomes);
        List<String> failed = report.failed();
        if (!failed.isEmpty()) {
            log.warn("Failed to initialize plugins: {}", String.join(", ", failed));
        }
        log.info("Plugin initialization complete: {}/{} successful",
                outcomes.size() - failed.size(), outcomes.size());
        return report;
    }

    // ==================== 执行 ====================

    /**
     * 执行插件操作（带帧预算）
     * <p>
     * 预算只用于观测：超出时打标记并告警，执行不会被中断。
     *
     * @param context 可选；提供时由管理器写入预算起点与上限
     */
    public PluginExecutionResult executePlugin(String name, PluginOperation operation, ExecutionContext context) {
        PluginRecord record = plugins.get(name);
        if (record == null || record.getStatus() != PluginStatus.ACTIVE) {
            return PluginExecutionResult.rejected(
                    new PluginExecutionException("Plugin " + name + " not active"));
        }

        GamePlugin plugin = record.getPlugin();
        if (!operation.isSupportedBy(plugin)) {
            return PluginExecutionResult.rejected(
                    new PluginExecutionException("Operation " + operation + " not supported by plugin " + name));
        }
        if (!operation.accepts(context)) {
            return PluginExecutionResult.rejected(new PluginExecutionException(
                    "Operation " + operation + " requires a " + operation.getContextType().getSimpleName()));
        }

        double budget = config.getMaxExecutionTimePerFrame();
        long startTime = System.nanoTime();
        if (context != null) {
            context.getPerformance().stamp(startTime, budget);
        }

        try {
            Object outcome = operation.invoke(plugin, context);
            double executionTime = elapsedMillis(startTime);
            boolean exceededBudget = checkBudget(name, operation, executionTime);

            if (outcome instanceof EffectResult effectResult && !effectResult.success()) {
                Throwable error = effectResult.error() != null
                        ? effectResult.error()
                        : new PluginExecutionException("Operation " + operation + " reported failure");
                record.recordError(error);
                log.warn("[{}] {} failed: {}", name, operation, error.getMessage());
                return PluginExecutionResult.failure(executionTime, error, exceededBudget);
            }

            record.recordExecution(executionTime);
            return PluginExecutionResult.success(executionTime, exceededBudget);
        } catch (Exception e) {
            double executionTime = elapsedMillis(startTime);
            boolean exceededBudget = checkBudget(name, operation, executionTime);
            record.recordError(e);
            log.error("[{}] {} threw after {}ms", name, operation, String.format("%.3f", executionTime), e);
            return PluginExecutionResult.failure(executionTime, e, exceededBudget);
        }
    }

    public PluginExecutionResult executePlugin(String name, PluginOperation operation) {
        return executePlugin(name, operation, null);
    }

    // ==================== 销毁 ====================

    /**
     * 销毁单个插件（限时）
     */
    public boolean destroyPlugin(String name) {
        PluginRecord record = plugins.get(name);
        if (record == null) {
            return false;
        }

        PluginStatus status = record.getStatus();
        if (status != PluginStatus.ACTIVE && status != PluginStatus.ERROR) {
            log.warn("[{}] Cannot destroy plugin in status {}", name, status);
            return false;
        }

        try {
            lifecycleExecutor.execute(name, LifecyclePhase.DESTROY, record.getPlugin()::destroy);
            record.transitionTo(PluginStatus.DESTROYED);
            activationOrder.remove(name);
            log.info("Plugin {} destroyed successfully", name);
            publish(new PluginEvent.PluginDestroyed(name));
            return true;
        } catch (PaddleFrameException e) {
            record.markFailed(e);
            log.error("Failed to destroy plugin {}: {}", name, e.getMessage(), e.getCause());
            publish(new PluginEvent.PluginFailed(name, LifecyclePhase.DESTROY.getDescription(), e));
            return false;
        }
    }

    /**
     * 按依赖逆序销毁所有激活的插件，单个失败不阻塞其余插件
     */
    public void destroyAll() {
        List<String> order;
        try {
            order = new ArrayList<>(resolveOrder());
            Collections.reverse(order);
        } catch (CircularDependencyException e) {
            log.warn("Dependency graph is cyclic ({}), destroying in reverse activation order", e.getMessage());
            order = new ArrayList<>(activationOrder);
            Collections.reverse(order);
        }

        int destroyed = 0;
        int failed = 0;
        for (String name : order) {
            PluginRecord record = plugins.get(name);
            if (record == null || record.getStatus() != PluginStatus.ACTIVE) {
                continue;
            }
            if (destroyPlugin(name)) {
                destroyed++;
            } else {
                failed++;
            }
        }
        log.info("All plugins destroyed: {} ok, {} failed", destroyed, failed);
    }

    /**
     * 关闭管理器：销毁全部插件并停止生命周期线程池
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return; // 已经关闭
        }
        log.info("Shutting down PluginManager...");
        destroyAll();
        lifecyclePool.shutdownNow();
        log.info("PluginManager shutdown complete.");
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    // ==================== 查询 ====================

    public Optional<GamePlugin> getPlugin(String name) {
        PluginRecord record = plugins.get(name);
        return record != null ? Optional.of(record.getPlugin()) : Optional.empty();
    }

    public <T extends GamePlugin> Optional<T> getPlugin(String name, Class<T> type) {
        return getPlugin(name).filter(type::isInstance).map(type::cast);
    }

    /**
     * 插件存在且处于 ACTIVE
     */
    public boolean hasPlugin(String name) {
        PluginRecord record = plugins.get(name);
        return record != null && record.getStatus() == PluginStatus.ACTIVE;
    }

    public List<String> getPluginNames() {
        return List.copyOf(plugins.keySet());
    }

    public Optional<PluginStatus> getStatus(String name) {
        PluginRecord record = plugins.get(name);
        return record != null ? Optional.of(record.getStatus()) : Optional.empty();
    }

    public Optional<PluginMetadata> getPluginMetadata(String name) {
        PluginRecord record = plugins.get(name);
        return record != null ? Optional.of(record.snapshot()) : Optional.empty();
    }

    /**
     * 当前依赖顺序
     *
     * @throws CircularDependencyException 依赖图存在环
     */
    public List<String> resolveOrder() {
        return DependencyResolver.resolve(plugins.values(), PluginRecord::getName,
                        record -> dependenciesOf(record.getPlugin()))
                .stream()
                .map(PluginRecord::getName)
                .collect(Collectors.toList());
    }

    public PerformanceStats getPerformanceStats() {
        double budget = config.getMaxExecutionTimePerFrame();
        int active = 0;
        double total = 0;
        List<String> exceeding = new ArrayList<>();

        for (PluginRecord record : plugins.values()) {
            if (record.getStatus() == PluginStatus.ACTIVE) {
                active++;
            }
            total += record.getTotalExecutionTime();
            if (record.getLastExecutionTime() > budget) {
                exceeding.add(record.getName());
            }
        }

        double average = active > 0 ? total / active : 0;
        return new PerformanceStats(plugins.size(), active, average, total, List.copyOf(exceeding));
    }

    // ==================== 内部方法 ====================

    private void validate(GamePlugin plugin) {
        if (plugin == null) {
            throw new PluginValidationException("Plugin cannot be null");
        }
        String name = plugin.getName();
        if (name == null || name.isBlank()) {
            throw new PluginValidationException("Plugin name cannot be blank");
        }
        String version = plugin.getVersion();
        if (version == null || version.isBlank()) {
            throw new PluginValidationException("Plugin " + name + " version cannot be blank");
        }
        for (String dependency : dependenciesOf(plugin)) {
            if (dependency == null || dependency.isBlank()) {
                throw new PluginValidationException("Plugin " + name + " declares a blank dependency");
            }
        }
    }

    private GamePlugin registeredPlugin(String name) {
        PluginRecord record = plugins.get(name);
        return record != null ? record.getPlugin() : null;
    }

    private List<String> dependenciesOf(GamePlugin plugin) {
        List<String> dependencies = plugin.getDependencies();
        return dependencies != null ? dependencies : Collections.emptyList();
    }

    private boolean checkBudget(String name, PluginOperation operation, double executionTime) {
        double budget = config.getMaxExecutionTimePerFrame();
        boolean exceeded = executionTime > budget;
        if (exceeded && config.isPerformanceMonitoring()) {
            log.warn("Plugin {} exceeded time budget: {}ms > {}ms",
                    name, String.format("%.2f", executionTime), budget);
            publish(new PluginEvent.BudgetExceeded(name, operation.name(), executionTime, budget));
        }
        return exceeded;
    }

    private static double elapsedMillis(long startTime) {
        return (System.nanoTime() - startTime) / 1_000_000.0;
    }

    private void publish(PluginEvent event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }
}
