package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.PlayerScope;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.effect.ValueResolver;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.PlayerState;

/**
 * Shuffles decks, optionally putting the hand in first and drawing afterwards.
 */
public class ShuffleEffectHandler extends AbstractEffectHandler<Effect.Shuffle> {

    public ShuffleEffectHandler() {
        super(Effect.Shuffle.class);
    }

    @Override
    public ApplyResult apply(GameState state, Effect.Shuffle effect, EffectContext context, ResolvedTargets targets) {
        PlayerScope scope = effect.target() == null ? PlayerScope.SELF : effect.target();
        int drawn = 0;
        for (int playerId : scope.players(context.sourcePlayer())) {
            PlayerState player = state.getPlayer(playerId);
            if (effect.shuffleHand()) {
                player.getDeck().addAllToBottom(player.getHand().removeAll());
            }
            player.getDeck().shuffle(state.getRng());
            if (effect.drawAfter() != null) {
                drawn += state.drawCards(playerId, ValueResolver.resolve(state, effect.drawAfter(), context));
            }
        }
        return ApplyResult.of(drawn);
    }
}
