package com.creaturebattle.effect;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.effect.handlers.AttackEnergyCostModifierEffectHandler;
import com.creaturebattle.effect.handlers.CoinFlipManipulationEffectHandler;
import com.creaturebattle.effect.handlers.DamageBoostEffectHandler;
import com.creaturebattle.effect.handlers.DamageReductionEffectHandler;
import com.creaturebattle.effect.handlers.DisableWeaknessEffectHandler;
import com.creaturebattle.effect.handlers.DrawEffectHandler;
import com.creaturebattle.effect.handlers.EndTurnEffectHandler;
import com.creaturebattle.effect.handlers.EnergyEffectHandler;
import com.creaturebattle.effect.handlers.EnergyTransferEffectHandler;
import com.creaturebattle.effect.handlers.EvolutionAccelerationEffectHandler;
import com.creaturebattle.effect.handlers.EvolutionFlexibilityEffectHandler;
import com.creaturebattle.effect.handlers.HandDiscardEffectHandler;
import com.creaturebattle.effect.handlers.HpBonusEffectHandler;
import com.creaturebattle.effect.handlers.HpEffectHandler;
import com.creaturebattle.effect.handlers.PreventAttackEffectHandler;
import com.creaturebattle.effect.handlers.PreventDamageEffectHandler;
import com.creaturebattle.effect.handlers.PreventEnergyAttachmentEffectHandler;
import com.creaturebattle.effect.handlers.PreventPlayingEffectHandler;
import com.creaturebattle.effect.handlers.PullEvolutionEffectHandler;
import com.creaturebattle.effect.handlers.RetreatCostIncreaseEffectHandler;
import com.creaturebattle.effect.handlers.RetreatCostReductionEffectHandler;
import com.creaturebattle.effect.handlers.RetreatPreventionEffectHandler;
import com.creaturebattle.effect.handlers.SearchEffectHandler;
import com.creaturebattle.effect.handlers.ShuffleEffectHandler;
import com.creaturebattle.effect.handlers.StatusEffectHandler;
import com.creaturebattle.effect.handlers.StatusPreventionEffectHandler;
import com.creaturebattle.effect.handlers.StatusRecoveryEffectHandler;
import com.creaturebattle.effect.handlers.SwapCardsEffectHandler;
import com.creaturebattle.effect.handlers.SwitchEffectHandler;
import com.creaturebattle.effect.handlers.ToolDiscardEffectHandler;
import com.creaturebattle.game.GameState;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps every effect kind to its handler. Handlers are stateless, so one registry serves
 * all games.
 */
public final class EffectHandlerRegistry {
    private static final EffectHandlerRegistry STANDARD = new EffectHandlerRegistry(List.of(
            new HpEffectHandler(),
            new StatusEffectHandler(),
            new StatusRecoveryEffectHandler(),
            new DrawEffectHandler(),
            new EnergyEffectHandler(),
            new EnergyTransferEffectHandler(),
            new SearchEffectHandler(),
            new ShuffleEffectHandler(),
            new HandDiscardEffectHandler(),
            new SwitchEffectHandler(),
            new ToolDiscardEffectHandler(),
            new EndTurnEffectHandler(),
            new CoinFlipManipulationEffectHandler(),
            new EvolutionAccelerationEffectHandler(),
            new PullEvolutionEffectHandler(),
            new SwapCardsEffectHandler(),
            new DamageBoostEffectHandler(),
            new DamageReductionEffectHandler(),
            new PreventDamageEffectHandler(),
            new HpBonusEffectHandler(),
            new RetreatPreventionEffectHandler(),
            new RetreatCostIncreaseEffectHandler(),
            new RetreatCostReductionEffectHandler(),
            new PreventAttackEffectHandler(),
            new PreventEnergyAttachmentEffectHandler(),
            new PreventPlayingEffectHandler(),
            new EvolutionFlexibilityEffectHandler(),
            new StatusPreventionEffectHandler(),
            new AttackEnergyCostModifierEffectHandler(),
            new DisableWeaknessEffectHandler()));

    private final Map<Class<?>, EffectHandler<?>> handlers = new HashMap<>();

    EffectHandlerRegistry(List<EffectHandler<?>> handlerList) {
        for (EffectHandler<?> handler : handlerList) {
            if (handlers.put(handler.effectType(), handler) != null) {
                throw new IllegalArgumentException("Two handlers for " + handler.effectType().getSimpleName());
            }
        }
    }

    public static EffectHandlerRegistry standard() {
        return STANDARD;
    }

    public boolean hasHandler(Class<? extends Effect> kind) {
        return handlers.containsKey(kind);
    }

    public <E extends Effect> EffectHandler<E> handlerFor(E effect) {
        EffectHandler<?> handler = handlers.get(effect.getClass());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + effect.getClass().getSimpleName());
        }
        // keyed by effectType(), so the handler takes exactly this effect's class
        @SuppressWarnings("unchecked")
        EffectHandler<E> typed = (EffectHandler<E>) handler;
        return typed;
    }

    public boolean canApply(GameState state, Effect effect, EffectContext context) {
        return handlerFor(effect).canApply(state, effect, context);
    }

    public List<ResolutionRequirement> getResolutionRequirements(Effect effect) {
        return handlerFor(effect).getResolutionRequirements(effect);
    }

    public ApplyResult apply(GameState state, Effect effect, EffectContext context, ResolvedTargets targets) {
        return handlerFor(effect).apply(state, effect, context, targets);
    }
}
