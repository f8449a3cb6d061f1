package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.HpOperation;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.DamageRules;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.effect.TargetResolver;
import com.creaturebattle.effect.ValueResolver;
import com.creaturebattle.game.GameState;
import com.creaturebattle.trigger.GameEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Heals or damages creatures. Healing stops at zero damage; damage stops at zero HP left.
 * Damage to the other player's creatures goes through their reductions and prevention.
 */
public class HpEffectHandler extends AbstractEffectHandler<Effect.Hp> {
    private static final Logger logger = LoggerFactory.getLogger(HpEffectHandler.class);

    public HpEffectHandler() {
        super(Effect.Hp.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.Hp effect) {
        return List.of(ResolutionRequirement.target(effect.target()));
    }

    @Override
    public ApplyResult apply(GameState state, Effect.Hp effect, EffectContext context, ResolvedTargets targets) {
        int amount = ValueResolver.resolve(state, effect.amount(), context);
        int total = 0;
        List<GameEvent> events = new ArrayList<>();
        for (FieldPosition target : targets.targets()) {
            if (effect.operation() == HpOperation.HEAL) {
                int healed = state.requireFieldCard(target).heal(amount);
                logger.debug("{} heals {} at {}", context.effectName(), healed, target);
                total += healed;
            } else {
                int damage = amount;
                if (target.playerId() != context.sourcePlayer()) {
                    FieldPosition source = TargetResolver.sourcePosition(state, context).orElse(null);
                    damage = DamageRules.afterDefenses(state, target, source, amount);
                }
                ApplyResult result = DamageRules.applyDamage(state, target, damage);
                logger.debug("{} deals {} to {}", context.effectName(), result.amountApplied(), target);
                total += result.amountApplied();
                events.addAll(result.events());
            }
        }
        return new ApplyResult(total, events);
    }
}
