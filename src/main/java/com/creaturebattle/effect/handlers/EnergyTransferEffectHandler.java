package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.effect.SelectionRole;
import com.creaturebattle.effect.ValueResolver;
import com.creaturebattle.game.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Moves energy of a single type from a source creature to a target creature. The type is
 * the first listed one the source holds.
 */
public class EnergyTransferEffectHandler extends AbstractEffectHandler<Effect.EnergyTransfer> {
    private static final Logger logger = LoggerFactory.getLogger(EnergyTransferEffectHandler.class);

    public EnergyTransferEffectHandler() {
        super(Effect.EnergyTransfer.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.EnergyTransfer effect) {
        return List.of(
                new ResolutionRequirement(SelectionRole.SOURCE, effect.source(), typesOf(effect)),
                ResolutionRequirement.target(effect.target()));
    }

    @Override
    public ApplyResult apply(GameState state, Effect.EnergyTransfer effect, EffectContext context,
                             ResolvedTargets targets) {
        Optional<FieldPosition> source = targets.source();
        Optional<FieldPosition> target = targets.firstTarget();
        if (source.isEmpty() || target.isEmpty() || source.get().equals(target.get())) {
            return ApplyResult.none();
        }
        String from = state.requireFieldCard(source.get()).getFieldInstanceId();
        String to = state.requireFieldCard(target.get()).getFieldInstanceId();
        Optional<EnergyType> type = typesOf(effect).stream()
                .filter(t -> state.getEnergy().count(from, t) > 0)
                .findFirst();
        if (type.isEmpty()) {
            return ApplyResult.none();
        }
        int requested = ValueResolver.resolve(state, effect.amount(), context);
        int amount = requested >= Effect.EnergyTransfer.ALL ? state.getEnergy().count(from, type.get()) : requested;
        int moved = state.getEnergy().transfer(from, to, type.get(), amount);
        logger.debug("{} moves {} {} energy {} -> {}", context.effectName(), moved, type.get().getJsonValue(),
                source.get(), target.get());
        return ApplyResult.of(moved);
    }

    private static List<EnergyType> typesOf(Effect.EnergyTransfer effect) {
        return effect.energyTypes().isEmpty() ? Arrays.asList(EnergyType.attachable()) : effect.energyTypes();
    }
}
