package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.CardType;
import com.creaturebattle.card.effect.CardLocation;
import com.creaturebattle.card.effect.CardTarget;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.effect.ValueResolver;
import com.creaturebattle.effect.filter.CardCriteriaFilter;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.PlayerState;
import com.creaturebattle.game.zones.CardInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Puts matching cards from the deck into the hand, taking them from the top down, then
 * shuffles the deck.
 */
public class SearchEffectHandler extends AbstractEffectHandler<Effect.Search> {
    private static final Logger logger = LoggerFactory.getLogger(SearchEffectHandler.class);

    public SearchEffectHandler() {
        super(Effect.Search.class);
    }

    /**
     * An item searching an empty deck cannot be played. Supporters still can.
     */
    @Override
    public boolean canApply(GameState state, Effect.Search effect, EffectContext context) {
        if (context instanceof EffectContext.Trainer trainer && trainer.cardType() == CardType.ITEM) {
            return !searchedPlayer(state, effect, context).getDeck().isEmpty();
        }
        return true;
    }

    @Override
    public ApplyResult apply(GameState state, Effect.Search effect, EffectContext context, ResolvedTargets targets) {
        CardTarget source = effect.source();
        if (source != null && source.location() != null && source.location() != CardLocation.DECK) {
            logger.warn("{}: searching {} is not supported", context.effectName(), source.location().getJsonValue());
            return ApplyResult.none();
        }
        PlayerState player = searchedPlayer(state, effect, context);
        int amount = ValueResolver.resolve(state, effect.amount(), context);
        List<CardInstance> found = player.getDeck().removeMatching(
                card -> CardCriteriaFilter.matches(state.getRepository(), source == null ? null : source.criteria(), card),
                amount);
        player.getHand().addAll(found);
        player.getDeck().shuffle(state.getRng());
        logger.debug("{} found {} card(s) for player {}", context.effectName(), found.size(), player.getId());
        return ApplyResult.of(found.size());
    }

    private static PlayerState searchedPlayer(GameState state, Effect.Search effect, EffectContext context) {
        if (effect.source() == null || effect.source().player() == null) {
            return state.getPlayer(context.sourcePlayer());
        }
        return state.getPlayer(effect.source().player().resolve(context.sourcePlayer()));
    }
}
