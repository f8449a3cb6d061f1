package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.Card;
import com.creaturebattle.card.CardType;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.effect.TargetResolution;
import com.creaturebattle.effect.TargetResolver;
import com.creaturebattle.effect.filter.CardCriteriaFilter;
import com.creaturebattle.game.EvolutionRules;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.PlayerState;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.game.zones.FieldCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Searches the target owner's deck for the target's next stage and evolves into it on the
 * spot. The deck is shuffled afterwards, whether or not a card was found.
 */
public class PullEvolutionEffectHandler extends AbstractEffectHandler<Effect.PullEvolution> {
    private static final Logger logger = LoggerFactory.getLogger(PullEvolutionEffectHandler.class);

    public PullEvolutionEffectHandler() {
        super(Effect.PullEvolution.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.PullEvolution effect) {
        return List.of(ResolutionRequirement.target(effect.target()));
    }

    @Override
    public boolean canApply(GameState state, Effect.PullEvolution effect, EffectContext context) {
        TargetResolution resolution = TargetResolver.resolve(state, effect.target(), context);
        if (resolution instanceof TargetResolution.Resolved resolved) {
            return resolved.positions().stream().anyMatch(p -> isEligible(state, p));
        }
        return resolution instanceof TargetResolution.RequiresSelection;
    }

    @Override
    public ApplyResult apply(GameState state, Effect.PullEvolution effect, EffectContext context,
                             ResolvedTargets targets) {
        int evolved = 0;
        for (FieldPosition target : targets.targets()) {
            if (!isEligible(state, target)) {
                logger.debug("{}: {} cannot be evolved", context.effectName(), target);
                continue;
            }
            PlayerState owner = state.getPlayer(target.playerId());
            String baseName = state.creatureData(state.requireFieldCard(target)).getName();
            List<CardInstance> found = owner.getDeck().removeMatching(
                    card -> isNextStage(state, effect, card, baseName), 1);
            owner.getDeck().shuffle(state.getRng());
            if (found.isEmpty()) {
                logger.info("{}: no evolution of {} in the deck", context.effectName(), baseName);
                continue;
            }
            EvolutionRules.evolve(state, target, found.get(0));
            logger.info("{} evolved {} into {}", context.effectName(), baseName, found.get(0).templateId());
            evolved++;
        }
        return ApplyResult.of(evolved);
    }

    private static boolean isEligible(GameState state, FieldPosition position) {
        Optional<FieldCard> card = state.fieldCardAt(position);
        return card.isPresent() && EvolutionRules.canEvolveNow(state, card.get());
    }

    private static boolean isNextStage(GameState state, Effect.PullEvolution effect, CardInstance card,
                                       String baseName) {
        if (card.cardType() != CardType.CREATURE) {
            return false;
        }
        Card.Creature creature = state.getRepository().getCreature(card.templateId());
        return EvolutionRules.descendsFrom(state.getRepository(), creature, baseName, 1)
                && CardCriteriaFilter.matches(state.getRepository(), effect.evolutionCriteria(), card);
    }
}
