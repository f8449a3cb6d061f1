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
import com.creaturebattle.game.zones.CardInstance;

import java.util.List;

/**
 * Discards cards from the end of the hand, or shuffles them back into the deck.
 */
public class HandDiscardEffectHandler extends AbstractEffectHandler<Effect.HandDiscard> {

    public HandDiscardEffectHandler() {
        super(Effect.HandDiscard.class);
    }

    @Override
    public boolean canApply(GameState state, Effect.HandDiscard effect, EffectContext context) {
        return scopeOf(effect).players(context.sourcePlayer()).stream()
                .anyMatch(p -> !state.getPlayer(p).getHand().isEmpty());
    }

    @Override
    public ApplyResult apply(GameState state, Effect.HandDiscard effect, EffectContext context,
                             ResolvedTargets targets) {
        int amount = ValueResolver.resolve(state, effect.amount(), context);
        int total = 0;
        for (int playerId : scopeOf(effect).players(context.sourcePlayer())) {
            PlayerState player = state.getPlayer(playerId);
            List<CardInstance> removed = player.getHand().removeFromEnd(amount);
            if (effect.shuffleIntoDeck()) {
                player.getDeck().addAllToBottom(removed);
                player.getDeck().shuffle(state.getRng());
            } else {
                player.getDiscard().addAll(removed);
            }
            total += removed.size();
        }
        return ApplyResult.of(total);
    }

    private static PlayerScope scopeOf(Effect.HandDiscard effect) {
        return effect.target() == null ? PlayerScope.SELF : effect.target();
    }
}
