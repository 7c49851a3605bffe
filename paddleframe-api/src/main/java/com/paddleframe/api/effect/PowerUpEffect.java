package com.paddleframe.api.effect;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 效果描述符：冲突与叠加规则
 *
 * @param id            效果标识
 * @param priority      冲突时优先级高者生效
 * @param stackable     是否允许叠加
 * @param conflictsWith 与之冲突的道具类型
 */
public record PowerUpEffect(String id,
                            int priority,
                            boolean stackable,
                            Set<PowerUpType> conflictsWith) implements Serializable {

    public PowerUpEffect {
        conflictsWith = conflictsWith == null || conflictsWith.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(conflictsWith));
    }

    public static PowerUpEffect of(String id, int priority, boolean stackable, PowerUpType... conflictsWith) {
        Set<PowerUpType> conflicts = EnumSet.noneOf(PowerUpType.class);
        Collections.addAll(conflicts, conflictsWith);
        return new PowerUpEffect(id, priority, stackable, conflicts);
    }

    public boolean conflictsWith(PowerUpType type) {
        return conflictsWith.contains(type);
    }
}
