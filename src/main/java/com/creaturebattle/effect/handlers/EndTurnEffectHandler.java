package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.game.GameState;

public class EndTurnEffectHandler extends AbstractEffectHandler<Effect.EndTurn> {

    public EndTurnEffectHandler() {
        super(Effect.EndTurn.class);
    }

    @Override
    public ApplyResult apply(GameState state, Effect.EndTurn effect, EffectContext context, ResolvedTargets targets) {
        state.getTurnState().setShouldEndTurn(true);
        return ApplyResult.none();
    }
}
