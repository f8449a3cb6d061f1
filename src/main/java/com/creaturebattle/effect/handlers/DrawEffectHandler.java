package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.effect.ValueResolver;
import com.creaturebattle.game.GameState;

/**
 * The acting player draws cards, as many as the deck holds.
 */
public class DrawEffectHandler extends AbstractEffectHandler<Effect.Draw> {

    public DrawEffectHandler() {
        super(Effect.Draw.class);
    }

    @Override
    public boolean canApply(GameState state, Effect.Draw effect, EffectContext context) {
        return !state.getPlayer(context.sourcePlayer()).getDeck().isEmpty();
    }

    @Override
    public ApplyResult apply(GameState state, Effect.Draw effect, EffectContext context, ResolvedTargets targets) {
        int amount = ValueResolver.resolve(state, effect.amount(), context);
        return ApplyResult.of(state.drawCards(context.sourcePlayer(), amount));
    }
}
