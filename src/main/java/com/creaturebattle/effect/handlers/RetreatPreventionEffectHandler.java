package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.game.GameState;

import java.util.List;

/**
 * Stops specific creatures from retreating. Unlike the criteria-based modifiers, the
 * target is resolved to concrete creatures when the effect applies.
 */
public class RetreatPreventionEffectHandler extends AbstractModifierHandler<Effect.RetreatPrevention> {

    public RetreatPreventionEffectHandler() {
        super(Effect.RetreatPrevention.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.RetreatPrevention effect) {
        return List.of(ResolutionRequirement.target(effect.target()));
    }

    @Override
    protected List<String> targetInstanceIds(GameState state, ResolvedTargets targets) {
        return instanceIdsAt(state, targets.targets());
    }
}
