package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;

public class DisableWeaknessEffectHandler extends AbstractModifierHandler<Effect.DisableWeakness> {

    public DisableWeaknessEffectHandler() {
        super(Effect.DisableWeakness.class);
    }
}
