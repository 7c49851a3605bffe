package com.paddleframe.core.effect;

import com.paddleframe.api.effect.EffectPlugin;
import com.paddleframe.api.effect.PowerUpType;
import com.paddleframe.core.plugin.PluginManager;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 道具插件注册表
 * <p>
 * 以注册 id（如 "paddle_large"）索引效果插件，并通过 PluginManager 完成注册。
 * 同一道具类型可以有多个变体；按类型查找时未指定或未知变体回落到该类型第一个注册的插件。
 */
@Slf4j
public class EffectPluginRegistry {

    private final PluginManager pluginManager;

    // Key=注册 id
    private final Map<String, EffectPlugin> plugins = new LinkedHashMap<>();

    // 类型 → (变体 → 注册 id)，变体按注册顺序
    private final Map<PowerUpType, Map<String, String>> variants = new EnumMap<>(PowerUpType.class);

    public EffectPluginRegistry(PluginManager pluginManager) {
        this.pluginManager = pluginManager;
    }

    public boolean register(String id, EffectPlugin plugin) {
        return register(id, plugin, id);
    }

    /**
     * 注册效果插件
     *
     * @param variant 变体名（如 "large"），为 null 时使用 id
     */
    public boolean register(String id, EffectPlugin plugin, String variant) {
        if (id == null || id.isBlank() || plugin == null) {
            log.error("Invalid effect plugin registration: id={}, plugin={}", id, plugin);
            return false;
        }
        if (plugins.containsKey(id)) {
            log.error("Effect plugin id '{}' is already registered", id);
            return false;
        }
        String variantKey = variant != null ? variant : id;
        Map<String, String> byVariant = variants.get(plugin.getPowerUpType());
        if (byVariant != null && byVariant.containsKey(variantKey)) {
            log.error("Variant '{}' of {} is already taken by '{}'",
                    variantKey, plugin.getPowerUpType(), byVariant.get(variantKey));
            return false;
        }
        if (!pluginManager.register(plugin)) {
            log.error("Failed to register effect plugin '{}' ({})", id, plugin.getName());
            return false;
        }

        plugins.put(id, plugin);
        variants.computeIfAbsent(plugin.getPowerUpType(), k -> new LinkedHashMap<>())
                .put(variantKey, id);
        log.info("Registered effect plugin '{}' ({})", id, plugin.getName());
        return true;
    }

    public Optional<EffectPlugin> getPlugin(String id) {
        return Optional.ofNullable(plugins.get(id));
    }

    /**
     * 按类型与变体查找
     */
    public Optional<EffectPlugin> getPluginByType(PowerUpType type, String variant) {
        Map<String, String> byVariant = variants.get(type);
        if (byVariant == null || byVariant.isEmpty()) {
            return Optional.empty();
        }
        String id = variant != null ? byVariant.get(variant) : null;
        if (id == null) {
            id = byVariant.values().iterator().next();
        }
        return getPlugin(id);
    }

    public Optional<EffectPlugin> getPluginByType(PowerUpType type) {
        return getPluginByType(type, null);
    }

    public List<String> getRegisteredIds() {
        return List.copyOf(plugins.keySet());
    }

    public RegistryStatus getStatus() {
        Map<PowerUpType, List<String>> idsByType = new EnumMap<>(PowerUpType.class);
        variants.forEach((type, byVariant) -> idsByType.put(type, List.copyOf(byVariant.values())));
        return new RegistryStatus(plugins.size(), getRegisteredIds(), Collections.unmodifiableMap(idsByType));
    }

    /**
     * 逆序注销全部插件，激活中的插件先销毁
     *
     * @return 成功注销的数量
     */
    public int unregisterAll() {
        List<String> ids = new ArrayList<>(plugins.keySet());
        Collections.reverse(ids);

        int removed = 0;
        for (String id : ids) {
            EffectPlugin plugin = plugins.get(id);
            String name = plugin.getName();
            if (pluginManager.hasPlugin(name) && !pluginManager.destroyPlugin(name)) {
                log.warn("Effect plugin '{}' failed to destroy, unregistering anyway", id);
            }
            if (pluginManager.unregister(name)) {
                removed++;
            } else {
                log.warn("Effect plugin '{}' could not be unregistered from the plugin manager", id);
            }
            plugins.remove(id);
            log.info("Unregistered effect plugin '{}'", id);
        }
        variants.clear();
        log.info("All effect plugins unregistered ({}/{})", removed, ids.size());
        return removed;
    }

    /**
     * 注册表状态
     */
    public record RegistryStatus(int totalRegistered,
                                 List<String> pluginIds,
                                 Map<PowerUpType, List<String>> pluginIdsByType) {
    }
}
