package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;

/**
 * Keeps special conditions off matching creatures. Checked whenever a status effect applies.
 */
public class StatusPreventionEffectHandler extends AbstractModifierHandler<Effect.StatusPrevention> {

    public StatusPreventionEffectHandler() {
        super(Effect.StatusPrevention.class);
    }
}
