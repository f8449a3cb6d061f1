package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.DurationPolicy;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.PassiveEffect;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.effect.TargetResolver;
import com.creaturebattle.effect.ValueResolver;
import com.creaturebattle.game.GameState;

import java.util.List;

/**
 * Registers a modifier as a passive effect. Amounts are resolved once, at registration.
 * Modifiers coming from an attached tool always last while the tool stays attached.
 */
public abstract class AbstractModifierHandler<E extends Effect.Modifier> extends AbstractEffectHandler<E> {

    protected AbstractModifierHandler(Class<E> effectType) {
        super(effectType);
    }

    /**
     * The modifier's amount, or null if it has none.
     */
    protected AmountSpec amountOf(E effect) {
        return null;
    }

    /**
     * Resolve the amount stored on the passive.
     */
    protected int resolveAmount(GameState state, E effect, EffectContext context) {
        return amountOf(effect) == null ? 0 : ValueResolver.resolve(state, amountOf(effect), context);
    }

    /**
     * Creatures the passive is pinned to at registration. Empty for criteria-based modifiers.
     */
    protected List<String> targetInstanceIds(GameState state, ResolvedTargets targets) {
        return List.of();
    }

    @Override
    public ApplyResult apply(GameState state, E effect, EffectContext context, ResolvedTargets targets) {
        int amount = resolveAmount(state, effect, context);
        DurationPolicy duration;
        String anchorInstance;
        String anchorTool = null;
        if (context instanceof EffectContext.Tool tool) {
            duration = DurationPolicy.WHILE_ATTACHED;
            anchorInstance = tool.creatureInstanceId();
            anchorTool = tool.toolInstanceId();
        } else {
            duration = effect.duration() == null ? DurationPolicy.UNTIL_END_OF_TURN : effect.duration();
            anchorInstance = context.sourceInstanceId();
            if (anchorInstance == null) {
                anchorInstance = TargetResolver.sourcePosition(state, context)
                        .map(p -> state.requireFieldCard(p).getFieldInstanceId())
                        .orElse(null);
            }
        }
        PassiveEffect passive = new PassiveEffect(null, context.sourcePlayer(), context.effectName(), effect, amount,
                duration, state.getTurn(), anchorInstance, anchorTool, targetInstanceIds(state, targets));
        state.getPassiveEffects().register(passive);
        return ApplyResult.of(amount);
    }

    protected static List<String> instanceIdsAt(GameState state, List<FieldPosition> positions) {
        return positions.stream().map(p -> state.requireFieldCard(p).getFieldInstanceId()).toList();
    }
}
