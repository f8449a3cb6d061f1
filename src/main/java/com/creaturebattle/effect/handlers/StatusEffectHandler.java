package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.PassiveEffectMatcher;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.game.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Puts a special condition on targeted active creatures. Bench targets and creatures
 * protected by a status prevention are skipped.
 */
public class StatusEffectHandler extends AbstractEffectHandler<Effect.Status> {
    private static final Logger logger = LoggerFactory.getLogger(StatusEffectHandler.class);

    public StatusEffectHandler() {
        super(Effect.Status.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.Status effect) {
        return List.of(ResolutionRequirement.target(effect.target()));
    }

    @Override
    public ApplyResult apply(GameState state, Effect.Status effect, EffectContext context, ResolvedTargets targets) {
        int applied = 0;
        for (FieldPosition target : targets.targets()) {
            if (!target.isActive()) {
                continue;
            }
            if (PassiveEffectMatcher.isStatusPrevented(state, target, effect.condition())) {
                logger.debug("{}: {} is protected from {}", context.effectName(), target,
                        effect.condition().getJsonValue());
            } else {
                state.getStatuses().apply(target.playerId(), effect.condition(), state.getTurn());
                applied++;
            }
        }
        return ApplyResult.of(applied);
    }
}
