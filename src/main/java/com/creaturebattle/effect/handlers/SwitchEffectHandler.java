package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.game.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Swaps a bench creature with its owner's active. The creature leaving the active spot
 * loses its special conditions.
 */
public class SwitchEffectHandler extends AbstractEffectHandler<Effect.Switch> {
    private static final Logger logger = LoggerFactory.getLogger(SwitchEffectHandler.class);

    public SwitchEffectHandler() {
        super(Effect.Switch.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.Switch effect) {
        return List.of(ResolutionRequirement.target(effect.target()));
    }

    @Override
    public ApplyResult apply(GameState state, Effect.Switch effect, EffectContext context, ResolvedTargets targets) {
        Optional<FieldPosition> target = targets.firstTarget();
        if (target.isEmpty() || target.get().isActive()) {
            logger.warn("{}: switch target must be a bench creature, got {}", context.effectName(), target);
            return ApplyResult.none();
        }
        int owner = target.get().playerId();
        state.getStatuses().clear(owner);
        state.getPlayer(owner).getField().swapWithActive(target.get().fieldIndex());
        state.getTurnState().removeAwaitingActive(owner);
        return ApplyResult.of(1);
    }
}
