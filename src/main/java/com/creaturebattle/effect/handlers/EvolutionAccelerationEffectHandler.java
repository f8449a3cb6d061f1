package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.Card;
import com.creaturebattle.card.CardType;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.EvolutionRestriction;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.AbstractEffectHandler;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.ResolutionRequirement;
import com.creaturebattle.effect.ResolvedTargets;
import com.creaturebattle.effect.TargetResolution;
import com.creaturebattle.effect.TargetResolver;
import com.creaturebattle.game.EvolutionRules;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.game.zones.FieldCard;
import com.creaturebattle.game.zones.Hand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Evolves a creature directly into a later stage from its owner's hand, skipping the
 * stages in between. The card is still used up when the hand holds no such evolution.
 */
public class EvolutionAccelerationEffectHandler extends AbstractEffectHandler<Effect.EvolutionAcceleration> {
    private static final Logger logger = LoggerFactory.getLogger(EvolutionAccelerationEffectHandler.class);

    public EvolutionAccelerationEffectHandler() {
        super(Effect.EvolutionAcceleration.class);
    }

    @Override
    public List<ResolutionRequirement> getResolutionRequirements(Effect.EvolutionAcceleration effect) {
        return List.of(ResolutionRequirement.target(effect.target()));
    }

    /**
     * A target known up front must be able to evolve now and meet the restrictions.
     */
    @Override
    public boolean canApply(GameState state, Effect.EvolutionAcceleration effect, EffectContext context) {
        TargetResolution resolution = TargetResolver.resolve(state, effect.target(), context);
        if (resolution instanceof TargetResolution.Resolved resolved) {
            return resolved.positions().stream().anyMatch(p -> isEligible(state, effect, p));
        }
        return resolution instanceof TargetResolution.RequiresSelection;
    }

    @Override
    public ApplyResult apply(GameState state, Effect.EvolutionAcceleration effect, EffectContext context,
                             ResolvedTargets targets) {
        int evolved = 0;
        for (FieldPosition target : targets.targets()) {
            if (!isEligible(state, effect, target)) {
                logger.debug("{}: {} cannot be evolved", context.effectName(), target);
                continue;
            }
            String baseName = state.creatureData(state.requireFieldCard(target)).getName();
            Hand hand = state.getPlayer(target.playerId()).getHand();
            Optional<Integer> index = findEvolution(state, hand, baseName, effect.skipStages() + 1);
            if (index.isEmpty()) {
                logger.info("{}: no card in hand evolves {} by {} stages", context.effectName(), baseName,
                        effect.skipStages() + 1);
                continue;
            }
            CardInstance evolution = hand.remove(index.get());
            EvolutionRules.evolve(state, target, evolution);
            logger.info("{} evolved {} into {}", context.effectName(), baseName, evolution.templateId());
            evolved++;
        }
        return ApplyResult.of(evolved);
    }

    private static boolean isEligible(GameState state, Effect.EvolutionAcceleration effect, FieldPosition position) {
        Optional<FieldCard> card = state.fieldCardAt(position);
        if (card.isEmpty() || !EvolutionRules.canEvolveNow(state, card.get())) {
            return false;
        }
        return !effect.restrictions().contains(EvolutionRestriction.BASIC_CREATURE_ONLY)
                || state.creatureData(card.get()).isBasic();
    }

    private static Optional<Integer> findEvolution(GameState state, Hand hand, String baseName, int stages) {
        for (int i = 0; i < hand.size(); i++) {
            CardInstance card = hand.get(i).orElseThrow();
            if (card.cardType() == CardType.CREATURE) {
                Card.Creature creature = state.getRepository().getCreature(card.templateId());
                if (EvolutionRules.descendsFrom(state.getRepository(), creature, baseName, stages)) {
                    return Optional.of(i);
                }
            }
        }
        return Optional.empty();
    }
}
