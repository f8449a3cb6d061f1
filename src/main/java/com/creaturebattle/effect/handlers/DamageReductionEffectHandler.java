package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.Effect;

/**
 * Subtracts damage taken by matching creatures.
 */
public class DamageReductionEffectHandler extends AbstractModifierHandler<Effect.DamageReduction> {

    public DamageReductionEffectHandler() {
        super(Effect.DamageReduction.class);
    }

    @Override
    protected AmountSpec amountOf(Effect.DamageReduction effect) {
        return effect.amount();
    }
}
