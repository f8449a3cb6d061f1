package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.zones.CardInstance;

import java.util.List;
import java.util.Optional;

/**
 * Sends the tools of targeted creatures to their owners' discard piles.
 */
public class ToolDiscardEffectHandler extends AbstractEffectHandler<Effect.ToolDiscard> {

    public ToolDiscardEffectHandler() {
        super(Effect.ToolDiscard.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.ToolDiscard effect) {
        return List.of(ResolutionRequirement.target(effect.target()));
    }

    @Override
    public ApplyResult apply(GameState state, Effect.ToolDiscard effect, EffectContext context,
                             ResolvedTargets targets) {
        int discarded = 0;
        for (FieldPosition target : targets.targets()) {
            String instanceId = state.requireFieldCard(target).getFieldInstanceId();
            Optional<CardInstance> tool = state.getTools().detach(instanceId);
            if (tool.isPresent()) {
                state.getPlayer(target.playerId()).getDiscard().add(tool.get());
                state.getPassiveEffects().clearForTool(tool.get().instanceId(), instanceId);
                discarded++;
            }
        }
        return ApplyResult.of(discarded);
    }
}
