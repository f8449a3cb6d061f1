package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;

public class PreventAttackEffectHandler extends AbstractModifierHandler<Effect.PreventAttack> {

    public PreventAttackEffectHandler() {
        super(Effect.PreventAttack.class);
    }
}
