package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.Effect;

public class RetreatCostReductionEffectHandler extends AbstractModifierHandler<Effect.RetreatCostReduction> {

    public RetreatCostReductionEffectHandler() {
        super(Effect.RetreatCostReduction.class);
    }

    @Override
    protected AmountSpec amountOf(Effect.RetreatCostReduction effect) {
        return effect.amount();
    }
}
