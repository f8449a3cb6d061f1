package com.creaturebattle.effect;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.game.GameState;

import java.util.List;

/**
 * Applies one kind of effect.
 *
 * @param <E> the effect kind handled
 */
public interface EffectHandler<E extends Effect> {

    Class<E> effectType();

    /**
     * Field targets to resolve before {@link #apply}, sources before targets.
     */
    List<ResolutionRequirement> getResolutionRequirements(E effect);

    /**
     * Whether the effect could do anything right now. Used to reject actions up front.
     */
    boolean canApply(GameState state, E effect, EffectContext context);

    ApplyResult apply(GameState state, E effect, EffectContext context, ResolvedTargets targets);
}
