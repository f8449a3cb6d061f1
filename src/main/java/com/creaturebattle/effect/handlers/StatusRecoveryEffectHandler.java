package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.game.GameState;

import java.util.List;

/**
 * Removes the listed conditions, or all of them, from targeted active creatures.
 */
public class StatusRecoveryEffectHandler extends AbstractEffectHandler<Effect.StatusRecovery> {

    public StatusRecoveryEffectHandler() {
        super(Effect.StatusRecovery.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.StatusRecovery effect) {
        return List.of(ResolutionRequirement.target(effect.target()));
    }

    @Override
    public ApplyResult apply(GameState state, Effect.StatusRecovery effect, EffectContext context,
                             ResolvedTargets targets) {
        int removed = 0;
        for (FieldPosition target : targets.targets()) {
            if (target.isActive()) {
                removed += state.getStatuses().removeAll(target.playerId(), effect.conditions());
            }
        }
        return ApplyResult.of(removed);
    }
}
