package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.Effect;

/**
 * Adds damage to matching attacks.
 */
public class DamageBoostEffectHandler extends AbstractModifierHandler<Effect.DamageBoost> {

    public DamageBoostEffectHandler() {
        super(Effect.DamageBoost.class);
    }

    @Override
    protected AmountSpec amountOf(Effect.DamageBoost effect) {
        return effect.amount();
    }
}
