package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;

/**
 * Cancels all damage to matching creatures from matching sources.
 */
public class PreventDamageEffectHandler extends AbstractModifierHandler<Effect.PreventDamage> {

    public PreventDamageEffectHandler() {
        super(Effect.PreventDamage.class);
    }
}
