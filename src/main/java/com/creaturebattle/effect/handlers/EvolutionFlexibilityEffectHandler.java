package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;

/**
 * Allows an evolution onto a creature it does not normally evolve from.
 */
public class EvolutionFlexibilityEffectHandler extends AbstractModifierHandler<Effect.EvolutionFlexibility> {

    public EvolutionFlexibilityEffectHandler() {
        super(Effect.EvolutionFlexibility.class);
    }
}
