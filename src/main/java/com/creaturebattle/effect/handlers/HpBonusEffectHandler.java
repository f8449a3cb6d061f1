package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.Effect;

/**
 * Raises the max HP of matching creatures.
 */
public class HpBonusEffectHandler extends AbstractModifierHandler<Effect.HpBonus> {

    public HpBonusEffectHandler() {
        super(Effect.HpBonus.class);
    }

    @Override
    protected AmountSpec amountOf(Effect.HpBonus effect) {
        return effect.amount();
    }
}
