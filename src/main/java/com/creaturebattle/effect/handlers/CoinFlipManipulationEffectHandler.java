package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.game.GameState;

/**
 * Makes the next coin flip come up heads.
 */
public class CoinFlipManipulationEffectHandler extends AbstractEffectHandler<Effect.CoinFlipManipulation> {

    public CoinFlipManipulationEffectHandler() {
        super(Effect.CoinFlipManipulation.class);
    }

    @Override
    public ApplyResult apply(GameState state, Effect.CoinFlipManipulation effect, EffectContext context,
                             ResolvedTargets targets) {
        state.getCoinFlipper().setNextFlipGuaranteedHeads();
        return ApplyResult.of(1);
    }
}
