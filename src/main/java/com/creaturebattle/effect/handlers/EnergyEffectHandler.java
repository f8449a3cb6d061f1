package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.EnergyOperation;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.effect.ValueResolver;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.zones.FieldCard;
import com.creaturebattle.trigger.GameEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches energy from nowhere, or discards attached energy into the owner's ledger.
 * A discard without an energy type takes any type.
 */
public class EnergyEffectHandler extends AbstractEffectHandler<Effect.Energy> {

    public EnergyEffectHandler() {
        super(Effect.Energy.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.Energy effect) {
        return List.of(ResolutionRequirement.target(effect.target()));
    }

    @Override
    public boolean canApply(GameState state, Effect.Energy effect, EffectContext context) {
        if (effect.operation() != EnergyOperation.DISCARD && effect.energyType() == null) {
            return false;
        }
        return super.canApply(state, effect, context);
    }

    @Override
    public ApplyResult apply(GameState state, Effect.Energy effect, EffectContext context, ResolvedTargets targets) {
        int amount = ValueResolver.resolve(state, effect.amount(), context);
        int total = 0;
        List<GameEvent> events = new ArrayList<>();
        for (FieldPosition target : targets.targets()) {
            FieldCard card = state.requireFieldCard(target);
            String instanceId = card.getFieldInstanceId();
            if (effect.operation() == EnergyOperation.DISCARD) {
                total += effect.energyType() == null
                        ? state.getEnergy().discardAny(target.playerId(), instanceId, amount)
                        : state.getEnergy().discard(target.playerId(), instanceId, effect.energyType(), amount);
            } else if (amount > 0) {
                state.getEnergy().attach(instanceId, effect.energyType(), amount);
                total += amount;
                events.add(new GameEvent.EnergyAttached(target.playerId(), instanceId, effect.energyType()));
            }
        }
        return new ApplyResult(total, events);
    }
}
