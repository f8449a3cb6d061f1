package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.Effect;

public class RetreatCostIncreaseEffectHandler extends AbstractModifierHandler<Effect.RetreatCostIncrease> {

    public RetreatCostIncreaseEffectHandler() {
        super(Effect.RetreatCostIncrease.class);
    }

    @Override
    protected AmountSpec amountOf(Effect.RetreatCostIncrease effect) {
        return effect.amount();
    }
}
