package com.paddleframe.core.effect;

import com.paddleframe.api.context.EffectContext;
import com.paddleframe.api.effect.EffectResult;
import com.paddleframe.api.effect.PowerUpEffect;
import com.paddleframe.api.effect.PowerUpType;
import com.paddleframe.api.effect.Rarity;

class StubEffectPlugin extends AbstractEffectPlugin {

    StubEffectPlugin(String name, PowerUpType type) {
        this(name, type, PowerUpEffect.of(name, 1, true));
    }

    StubEffectPlugin(String name, PowerUpType type, PowerUpEffect effect) {
        super(name, "1.0.0", type, effect);
    }

    @Override
    protected EffectResult onApplyEffect(EffectContext context) {
        return EffectResult.applied();
    }

    @Override
    protected EffectResult onRemoveEffect(EffectContext context) {
        return EffectResult.applied();
    }

    @Override
    protected String getIcon() {
        return "stub.png";
    }

    @Override
    protected String getColor() {
        return "#ffffff";
    }

    @Override
    protected Rarity getRarity() {
        return Rarity.RARE;
    }

    @Override
    protected long getDuration() {
        return 10_000;
    }
}
