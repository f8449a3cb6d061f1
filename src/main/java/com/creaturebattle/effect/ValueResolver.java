package com.creaturebattle.effect;

import com.creaturebattle.card.CardType;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.CardLocation;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.PlayerRef;
import com.creaturebattle.effect.filter.CardCriteriaFilter;
import com.creaturebattle.effect.filter.FieldCriteriaFilter;
import com.creaturebattle.effect.filter.FieldTargetCriteriaFilter;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.PlayerState;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.game.zones.EvolutionEntry;
import com.creaturebattle.game.zones.FieldCard;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates {@link AmountSpec}s against the current state. Results are never negative,
 * except from {@link #resolveSigned}.
 * Apart from coin flips, which advance the game's coin flipper, resolution reads state only.
 */
public final class ValueResolver {

    private ValueResolver() {
    }

    public static int resolve(GameState state, AmountSpec spec, EffectContext context) {
        return Math.max(0, evaluate(state, spec, context));
    }

    /**
     * Like {@link #resolve}, but keeps a negative result. Only the top level is signed;
     * nested amounts are still floored at zero.
     */
    public static int resolveSigned(GameState state, AmountSpec spec, EffectContext context) {
        return evaluate(state, spec, context);
    }

    private static int evaluate(GameState state, AmountSpec spec, EffectContext context) {
        if (spec == null) {
            return 0;
        }
        if (spec instanceof AmountSpec.Constant constant) {
            return constant.value();
        }
        if (spec instanceof AmountSpec.PlayerContext playerContext) {
            return playerContext(state, playerContext, context);
        }
        if (spec instanceof AmountSpec.Count count) {
            return count(state, count, context);
        }
        if (spec instanceof AmountSpec.Addition addition) {
            int sum = 0;
            for (AmountSpec value : addition.values()) {
                sum += resolve(state, value, context);
            }
            return sum;
        }
        if (spec instanceof AmountSpec.Multiplication multiplication) {
            return resolve(state, multiplication.base(), context) * resolve(state, multiplication.multiplier(), context);
        }
        if (spec instanceof AmountSpec.Conditional conditional) {
            Optional<FieldCard> source = TargetResolver.sourcePosition(state, context).flatMap(state::fieldCardAt);
            boolean holds = source.isPresent()
                    && FieldCriteriaFilter.matches(state, conditional.condition(), source.get());
            return resolve(state, holds ? conditional.trueValue() : conditional.falseValue(), context);
        }
        AmountSpec.CoinFlip coinFlip = (AmountSpec.CoinFlip) spec;
        int flips = coinFlip.flipCount() == null ? 1 : coinFlip.flipCount();
        int heads = state.getCoinFlipper().flipHeads(flips);
        return heads * resolve(state, coinFlip.headsValue(), context)
                + (flips - heads) * resolve(state, coinFlip.tailsValue(), context);
    }

    private static int playerContext(GameState state, AmountSpec.PlayerContext spec, EffectContext context) {
        PlayerState player = state.getPlayer(playerOf(spec.player(), context));
        return switch (spec.source()) {
            case HAND_SIZE -> player.getHand().size();
            case CURRENT_POINTS -> player.getPoints();
            case POINTS_TO_WIN -> Math.max(0, state.getConfig().getPointsToWin() - player.getPoints());
        };
    }

    private static int count(GameState state, AmountSpec.Count spec, EffectContext context) {
        if (spec.countType() == null) {
            return 0;
        }
        return switch (spec.countType()) {
            case FIELD -> matchingCreatures(state, spec, context).size();
            case DAMAGE -> matchingCreatures(state, spec, context).stream()
                    .mapToInt(FieldCard::getDamageTaken)
                    .sum();
            case ENERGY -> {
                List<EnergyType> types = spec.energyTypes() == null || spec.energyTypes().isEmpty()
                        ? Arrays.asList(EnergyType.attachable())
                        : spec.energyTypes();
                int total = 0;
                for (FieldCard card : matchingCreatures(state, spec, context)) {
                    for (EnergyType type : types) {
                        total += state.getEnergy().count(card.getFieldInstanceId(), type);
                    }
                }
                yield total;
            }
            case CARD -> {
                PlayerState player = state.getPlayer(playerOf(spec.player(), context));
                int total = 0;
                for (CardInstance card : cardsIn(player, spec.location())) {
                    if (CardCriteriaFilter.matches(state.getRepository(), spec.cardCriteria(), card)) {
                        total++;
                    }
                }
                yield total;
            }
        };
    }

    private static List<FieldCard> matchingCreatures(GameState state, AmountSpec.Count spec, EffectContext context) {
        List<FieldCard> cards = new ArrayList<>();
        for (FieldPosition position : FieldTargetCriteriaFilter.matching(state, spec.criteria(), context.sourcePlayer())) {
            cards.add(state.requireFieldCard(position));
        }
        return cards;
    }

    private static List<CardInstance> cardsIn(PlayerState player, CardLocation location) {
        if (location == null) {
            return player.getHand().getCards();
        }
        return switch (location) {
            case HAND -> player.getHand().getCards();
            case DECK -> player.getDeck().getCards();
            case DISCARD -> player.getDiscard().getCards();
            case FIELD -> {
                List<CardInstance> inPlay = new ArrayList<>();
                for (FieldCard card : player.getField().getAll()) {
                    EvolutionEntry top = card.getCurrentForm();
                    inPlay.add(new CardInstance(top.instanceId(), top.templateId(), CardType.CREATURE));
                }
                yield inPlay;
            }
        };
    }

    private static int playerOf(PlayerRef ref, EffectContext context) {
        return ref == null ? context.sourcePlayer() : ref.resolve(context.sourcePlayer());
    }
}
