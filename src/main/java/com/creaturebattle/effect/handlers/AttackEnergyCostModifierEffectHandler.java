package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ValueResolver;
import com.creaturebattle.game.GameState;

/**
 * Raises or lowers the energy cost of matching creatures' attacks. The stored amount
 * keeps its sign.
 */
public class AttackEnergyCostModifierEffectHandler extends AbstractModifierHandler<Effect.AttackEnergyCostModifier> {

    public AttackEnergyCostModifierEffectHandler() {
        super(Effect.AttackEnergyCostModifier.class);
    }

    @Override
    protected AmountSpec amountOf(Effect.AttackEnergyCostModifier effect) {
        return effect.amount();
    }

    @Override
    protected int resolveAmount(GameState state, Effect.AttackEnergyCostModifier effect, EffectContext context) {
        return ValueResolver.resolveSigned(state, effect.amount(), context);
    }
}
