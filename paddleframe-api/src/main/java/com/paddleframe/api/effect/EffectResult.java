package com.paddleframe.api.effect;

import java.util.Optional;

/**
 * 效果执行结果：带标签的结果值而不是异常
 *
 * @param success  是否成功
 * @param modified 是否修改了游戏状态
 * @param rollback 可选的回滚补丁（仅成功时）
 * @param error    失败原因
 */
public record EffectResult(boolean success,
                           boolean modified,
                           EffectPatch rollback,
                           Throwable error) {

    private static final EffectResult UNCHANGED = new EffectResult(true, false, null, null);

    public static EffectResult unchanged() {
        return UNCHANGED;
    }

    public static EffectResult applied() {
        return new EffectResult(true, true, null, null);
    }

    public static EffectResult applied(EffectPatch rollback) {
        return new EffectResult(true, true, rollback, null);
    }

    public static EffectResult failure(Throwable error) {
        return new EffectResult(false, false, null, error);
    }

    public Optional<EffectPatch> findRollback() {
        return Optional.ofNullable(rollback);
    }
}
