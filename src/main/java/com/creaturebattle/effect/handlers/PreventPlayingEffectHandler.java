package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;

/**
 * Stops the scoped players from playing cards of the listed types.
 */
public class PreventPlayingEffectHandler extends AbstractModifierHandler<Effect.PreventPlaying> {

    public PreventPlayingEffectHandler() {
        super(Effect.PreventPlaying.class);
    }
}
