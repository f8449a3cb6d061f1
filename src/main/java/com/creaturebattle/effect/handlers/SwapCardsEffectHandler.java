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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Discards cards from the start of the hand, then draws replacements. A player with an
 * empty hand neither discards nor draws.
 */
public class SwapCardsEffectHandler extends AbstractEffectHandler<Effect.SwapCards> {
    private static final Logger logger = LoggerFactory.getLogger(SwapCardsEffectHandler.class);

    public SwapCardsEffectHandler() {
        super(Effect.SwapCards.class);
    }

    @Override
    public ApplyResult apply(GameState state, Effect.SwapCards effect, EffectContext context, ResolvedTargets targets) {
        int discardAmount = ValueResolver.resolve(state, effect.discardAmount(), context);
        int drawAmount = ValueResolver.resolve(state, effect.drawAmount(), context);
        int totalDrawn = 0;
        for (int playerId : scopeOf(effect).players(context.sourcePlayer())) {
            PlayerState player = state.getPlayer(playerId);
            if (player.getHand().isEmpty()) {
                logger.debug("{}: player {} has no cards to swap", context.effectName(), playerId);
                continue;
            }
            List<CardInstance> discarded = player.getHand().removeFromStart(discardAmount);
            player.getDiscard().addAll(discarded);

            int toDraw = effect.balanced() ? discarded.size() : drawAmount;
            if (effect.maxDrawn() != null) {
                toDraw = Math.min(toDraw, effect.maxDrawn());
            }
            int drawn = state.drawCards(playerId, toDraw);
            logger.debug("{}: player {} discarded {} and drew {}", context.effectName(), playerId,
                    discarded.size(), drawn);
            totalDrawn += drawn;
        }
        return ApplyResult.of(totalDrawn);
    }

    private static PlayerScope scopeOf(Effect.SwapCards effect) {
        return effect.target() == null ? PlayerScope.SELF : effect.target();
    }
}
