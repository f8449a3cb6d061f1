package com.creaturebattle.effect;

import com.creaturebattle.card.effect.Effect;

/**
 * An effect waiting in the queue together with the context it was produced in.
 */
public record QueuedEffect(Effect effect, EffectContext context) {
}
