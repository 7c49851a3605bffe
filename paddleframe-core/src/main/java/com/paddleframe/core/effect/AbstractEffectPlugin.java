package com.paddleframe.core.effect;

import com.paddleframe.api.context.ActiveEffects;
import com.paddleframe.api.context.EffectContext;
import com.paddleframe.api.context.PerformanceBudget;
import com.paddleframe.api.effect.EffectEvent;
import com.paddleframe.api.effect.EffectEventListener;
import com.paddleframe.api.effect.EffectPatch;
import com.paddleframe.api.effect.EffectPerformanceMetrics;
import com.paddleframe.api.effect.EffectPlugin;
import com.paddleframe.api.effect.EffectResult;
import com.paddleframe.api.effect.PowerUpEffect;
import com.paddleframe.api.effect.PowerUpMetadata;
import com.paddleframe.api.effect.PowerUpType;
import com.paddleframe.api.effect.Rarity;
import com.paddleframe.core.exception.BudgetExceededException;
import com.paddleframe.core.exception.EffectConflictException;
import com.paddleframe.core.exception.EffectNotInitializedException;
import com.paddleframe.core.exception.PluginExecutionException;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 效果插件基类
 * <p>
 * 每个公开方法都是对受保护钩子的薄封装：
 * 1. 未初始化时直接返回 "not initialized" 失败结果
 * 2. 记录开始时间并累计耗时
 * 3. 钩子抛出的异常转换为失败结果
 * 4. applyEffect 成功时累加激活次数
 * <p>
 * 状态：Uninitialized → Initialized（init 成功）→ Uninitialized（destroy）
 */
@Slf4j
public abstract class AbstractEffectPlugin implements EffectPlugin {

    @Getter
    private final String name;

    @Getter
    private final String version;

    @Getter
    private final String description;

    @Getter
    private final PowerUpType powerUpType;

    private final List<String> dependencies;

    // 当前效果描述符，子类可在运行时替换（例如升级后的优先级）
    private volatile PowerUpEffect effect;

    // init/destroy 在生命周期线程上执行
    private volatile boolean initialized = false;

    private double totalExecutionTime;
    private long activations;

    @Setter
    private EffectEventListener eventListener; // 可选，由宿主桥接到游戏事件总线

    protected AbstractEffectPlugin(String name,
                                   String version,
                                   PowerUpType powerUpType,
                                   PowerUpEffect effect,
                                   String description,
                                   List<String> dependencies) {
        this.name = Objects.requireNonNull(name, "name");
        this.version = Objects.requireNonNull(version, "version");
        this.powerUpType = Objects.requireNonNull(powerUpType, "powerUpType");
        this.effect = Objects.requireNonNull(effect, "effect");
        this.description = description != null ? description : powerUpType.getId() + " power-up plugin";
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    protected AbstractEffectPlugin(String name, String version, PowerUpType powerUpType, PowerUpEffect effect) {
        this(name, version, powerUpType, effect, null, null);
    }

    @Override
    public List<String> getDependencies() {
        return dependencies;
    }

    @Override
    public PowerUpEffect getEffect() {
        return effect;
    }

    protected void setEffect(PowerUpEffect effect) {
        this.effect = Objects.requireNonNull(effect, "effect");
    }

    public boolean isInitialized() {
        return initialized;
    }

    // ==================== 生命周期 ====================

    @Override
    public final void init() throws Exception {
        try {
            onInit();
            initialized = true;
            log.info("[{}] Effect plugin initialized", name);
        } catch (Exception e) {
            log.error("[{}] Failed to initialize effect plugin", name, e);
            throw e;
        }
    }

    @Override
    public final void destroy() throws Exception {
        try {
            onDestroy();
            initialized = false;
            log.info("[{}] Effect plugin destroyed", name);
        } catch (Exception e) {
            log.error("[{}] Failed to destroy effect plugin", name, e);
            throw e;
        }
    }

    // ==================== 效果方法 ====================

    @Override
    public EffectResult applyEffect(EffectContext context) {
        if (!initialized) {
            return notInitialized();
        }

        long startTime = System.nanoTime();
        try {
            EffectResult validation = validateEffect(context);
            if (!validation.success()) {
                log.debug("[{}] Effect validation failed: {}", name, validation.error().getMessage());
                return validation;
            }

            EffectResult result = checked(onApplyEffect(context), "applyEffect");
            if (result.success()) {
                activations++;
                fire(EffectEvent.ACTIVATE, context);
            }
            return result;
        } catch (Exception e) {
            log.error("[{}] Effect application failed", name, e);
            return EffectResult.failure(e);
        } finally {
            recordExecutionTime(startTime);
        }
    }

    @Override
    public EffectResult removeEffect(EffectContext context) {
        if (!initialized) {
            return notInitialized();
        }

        long startTime = System.nanoTime();
        try {
            EffectResult result = checked(onRemoveEffect(context), "removeEffect");
            if (result.success()) {
                fire(EffectEvent.DEACTIVATE, context);
            }
            return result;
        } catch (Exception e) {
            log.error("[{}] Effect removal failed", name, e);
            return EffectResult.failure(e);
        } finally {
            recordExecutionTime(startTime);
        }
    }

    @Override
    public EffectResult updateEffect(EffectContext context) {
        if (!initialized) {
            return notInitialized();
        }

        long startTime = System.nanoTime();
        try {
            EffectResult result = checked(onUpdateEffect(context), "updateEffect");
            if (result.success() && result.modified()) {
                fire(EffectEvent.UPDATE, context);
            }
            return result;
        } catch (Exception e) {
            log.error("[{}] Effect update failed", name, e);
            return EffectResult.failure(e);
        } finally {
            recordExecutionTime(startTime);
        }
    }

    @Override
    public EffectResult handleConflict(PowerUpType conflictingType, EffectContext context) {
        if (!initialized) {
            return notInitialized();
        }

        long startTime = System.nanoTime();
        try {
            EffectResult result = checked(onHandleConflict(conflictingType, context), "handleConflict");
            if (result.success()) {
                // 同类型且可叠加视为叠加，否则为冲突
                boolean stacking = conflictingType == powerUpType && effect.stackable();
                fire(stacking ? EffectEvent.STACK : EffectEvent.CONFLICT, context);
            }
            return result;
        } catch (Exception e) {
            log.error("[{}] Conflict handling with {} failed", name, conflictingType, e);
            return EffectResult.failure(e);
        } finally {
            recordExecutionTime(startTime);
        }
    }

    @Override
    public EffectResult revert(EffectPatch patch, EffectContext context) {
        if (!initialized) {
            return notInitialized();
        }
        if (patch == null) {
            return EffectResult.failure(new IllegalArgumentException("Patch cannot be null"));
        }
        if (!effect.id().equals(patch.effectId())) {
            return EffectResult.failure(new IllegalArgumentException(
                    "Patch for effect " + patch.effectId() + " cannot be reverted by " + name));
        }

        long startTime = System.nanoTime();
        try {
            EffectResult result = checked(onRevert(patch, context), "revert");
            if (result.success()) {
                log.info("[{}] Effect rolled back ({} properties)", name, patch.properties().size());
            }
            return result;
        } catch (Exception e) {
            log.error("[{}] Rollback failed", name, e);
            return EffectResult.failure(e);
        } finally {
            recordExecutionTime(startTime);
        }
    }

    // ==================== 元数据与指标 ====================

    @Override
    public PowerUpMetadata getMetadata() {
        return new PowerUpMetadata(
                powerUpType,
                name,
                description,
                getIcon(),
                getColor(),
                getRarity(),
                getDuration(),
                effect
        );
    }

    @Override
    public EffectPerformanceMetrics getPerformanceMetrics() {
        double average = activations > 0 ? totalExecutionTime / activations : 0;
        return new EffectPerformanceMetrics(totalExecutionTime, average, activations, initialized);
    }

    // ==================== 子类钩子 ====================

    protected void onInit() throws Exception {
        log.debug("[{}] {} plugin initialized", name, powerUpType.getId());
    }

    protected void onDestroy() throws Exception {
        log.debug("[{}] {} plugin destroyed", name, powerUpType.getId());
    }

    protected abstract EffectResult onApplyEffect(EffectContext context) throws Exception;

    protected abstract EffectResult onRemoveEffect(EffectContext context) throws Exception;

    /**
     * 默认无逐帧更新
     */
    protected EffectResult onUpdateEffect(EffectContext context) throws Exception {
        return EffectResult.unchanged();
    }

    /**
     * 默认与其他类型无冲突
     */
    protected EffectResult onHandleConflict(PowerUpType conflictingType, EffectContext context) throws Exception {
        return EffectResult.unchanged();
    }

    /**
     * 按补丁还原；不支持补丁回滚的插件保持默认实现
     */
    protected EffectResult onRevert(EffectPatch patch, EffectContext context) throws Exception {
        return EffectResult.failure(new UnsupportedOperationException(name + " does not support rollback"));
    }

    protected abstract String getIcon();

    protected abstract String getColor();

    protected abstract Rarity getRarity();

    /**
     * 持续时间（毫秒）
     */
    protected abstract long getDuration();

    // ==================== 辅助方法 ====================

    /**
     * 应用前校验：剩余时间预算 + 与当前生效效果的冲突前置条件
     */
    protected EffectResult validateEffect(EffectContext context) {
        if (context == null) {
            return EffectResult.failure(new IllegalArgumentException("Effect context cannot be null"));
        }

        PerformanceBudget budget = context.getPerformance();
        if (budget.isExceeded()) {
            return EffectResult.failure(
                    new BudgetExceededException(budget.elapsedMillis(), budget.getMaxExecutionTime()));
        }

        ActiveEffects activeEffects = context.getActiveEffects();
        if (activeEffects != null) {
            for (PowerUpType type : effect.conflictsWith()) {
                if (activeEffects.isActive(type)) {
                    return EffectResult.failure(new EffectConflictException(name, type));
                }
            }
        }

        return EffectResult.unchanged();
    }

    /**
     * 以当前效果标识创建回滚补丁
     */
    protected EffectPatch createPatch(EffectContext context, Map<String, Object> before, Map<String, Object> after) {
        String powerUpId = context != null ? context.getPowerUpId() : null;
        return new EffectPatch(effect.id(), powerUpId, before, after);
    }

    private EffectResult checked(EffectResult result, String operation) {
        if (result == null) {
            throw new PluginExecutionException(name + "." + operation + " returned no result");
        }
        return result;
    }

    private EffectResult notInitialized() {
        return EffectResult.failure(new EffectNotInitializedException(name));
    }

    private void recordExecutionTime(long startTime) {
        totalExecutionTime += (System.nanoTime() - startTime) / 1_000_000.0;
    }

    private void fire(EffectEvent event, EffectContext context) {
        if (eventListener == null) {
            return;
        }
        try {
            eventListener.onEffectEvent(event, this, context);
        } catch (Exception e) {
            log.error("[{}] Effect event listener failed on {}", name, event, e);
        }
    }
}
