package com.creaturebattle.effect;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.game.GameState;

import java.util.List;

/**
 * Base handler. By default an effect needs no targets and can apply whenever each of its
 * requirements is available.
 */
public abstract class AbstractEffectHandler<E extends Effect> implements EffectHandler<E> {
    private final Class<E> effectType;

    protected AbstractEffectHandler(Class<E> effectType) {
        this.effectType = effectType;
    }

    @Override
    public Class<E> effectType() {
        return effectType;
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(E effect) {
        return List.of();
    }

    @Override
    public boolean canApply(GameState state, E effect, EffectContext context) {
        for (ResolutionRequirement requirement : getResolutionRequirements(effect)) {
            if (!TargetResolver.isAvailable(state, requirement.target(), context, requirement.energyFilter())) {
                return false;
            }
        }
        return true;
    }
}
