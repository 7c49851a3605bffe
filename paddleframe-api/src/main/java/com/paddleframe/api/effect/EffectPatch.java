package com.paddleframe.api.effect;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 效果补丁：记录一次效果应用修改的属性前后快照
 * <p>
 * 补丁是纯数据，可序列化、可独立测试。Core 从不自动回滚，
 * 由调用方在多插件事务的后续步骤失败时交回 {@link EffectPlugin#revert} 执行。
 * </p>
 *
 * @param effectId  产生补丁的效果标识
 * @param powerUpId 对应的道具实例
 * @param before    修改前的属性值
 * @param after     修改后的属性值
 */
public record EffectPatch(String effectId,
                          String powerUpId,
                          Map<String, Object> before,
                          Map<String, Object> after) implements Serializable {

    public EffectPatch {
        before = Collections.unmodifiableMap(new LinkedHashMap<>(before == null ? Map.of() : before));
        after = Collections.unmodifiableMap(new LinkedHashMap<>(after == null ? Map.of() : after));
    }

    public Set<String> properties() {
        return before.keySet();
    }

    public Object before(String property) {
        return before.get(property);
    }

    public Object after(String property) {
        return after.get(property);
    }

    /**
     * 反向补丁（交换前后快照）
     */
    public EffectPatch inverse() {
        return new EffectPatch(effectId, powerUpId, after, before);
    }
}
