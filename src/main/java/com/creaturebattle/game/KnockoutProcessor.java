package com.creaturebattle.game;

import com.creaturebattle.card.CardType;
import com.creaturebattle.card.CreatureAttributes;
import com.creaturebattle.card.CreatureCard;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.DrainStatus;
import com.creaturebattle.effect.EffectQueue;
import com.creaturebattle.effect.PassiveEffectMatcher;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.game.zones.EvolutionEntry;
import com.creaturebattle.game.zones.FieldCard;
import com.creaturebattle.trigger.GameEvent;
import com.creaturebattle.trigger.TriggerDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Removes knocked-out creatures, awards points and decides the winner.
 */
public final class KnockoutProcessor {
    private static final Logger logger = LoggerFactory.getLogger(KnockoutProcessor.class);

    private KnockoutProcessor() {
        // Utility class - prevent instantiation
    }

    /**
     * Whether the creature's damage has reached its effective HP.
     */
    public static boolean isKnockedOut(GameState state, FieldPosition position) {
        Optional<FieldCard> card = state.fieldCardAt(position);
        return card.isPresent()
                && card.get().getDamageTaken() >= PassiveEffectMatcher.effectiveHp(state, position);
    }

    /**
     * Process every creature at or past its HP, current player's side first.
     *
     * Before-knockout triggers fire once per creature and are drained before the creature
     * is checked again, so a trigger that heals it saves it. If one of those triggers
     * needs a selection, processing stops and should be called again once the queue is idle.
     *
     * @param state The current game state
     * @return AWAITING_SELECTION if a before-knockout trigger is waiting on a choice
     */
    public static DrainStatus processKnockouts(GameState state) {
        List<String> pending = knockedOutInstances(state);
        while (!pending.isEmpty() && !state.isGameOver()) {
            String instanceId = pending.get(0);
            FieldPosition position = state.locate(instanceId).orElseThrow();
            if (state.getTurnState().markBeforeKnockoutFired(instanceId)) {
                TriggerDispatcher.onEvent(state, new GameEvent.BeforeKnockout(position.playerId(), instanceId));
                if (EffectQueue.drain(state) == DrainStatus.AWAITING_SELECTION) {
                    return DrainStatus.AWAITING_SELECTION;
                }
            }
            state.getTurnState().clearBeforeKnockoutFired(instanceId);
            Optional<FieldPosition> current = state.locate(instanceId);
            if (current.isPresent() && isKnockedOut(state, current.get())) {
                knockOut(state, current.get());
            } else {
                logger.debug("{} survived its knockout", instanceId);
            }
            // triggers may have damaged or healed other creatures
            pending = knockedOutInstances(state);
        }
        return DrainStatus.IDLE;
    }

    /**
     * Take the creature off the field. Its whole evolution stack and its tool go to the
     * owner's discard pile, its energy to the discarded ledger.
     */
    static void knockOut(GameState state, FieldPosition position) {
        int owner = position.playerId();
        int opponent = GameState.opponentOf(owner);
        PlayerState ownerState = state.getPlayer(owner);
        FieldCard card = ownerState.getField().remove(position.fieldIndex());
        int points = pointsFor(state.creatureData(card));
        String instanceId = card.getFieldInstanceId();

        for (EvolutionEntry entry : card.getEvolutionStack()) {
            ownerState.getDiscard().add(new CardInstance(entry.instanceId(), entry.templateId(), CardType.CREATURE));
        }
        state.getTools().detach(instanceId).ifPresent(tool -> {
            ownerState.getDiscard().add(tool);
            state.getPassiveEffects().clearForTool(tool.instanceId(), instanceId);
        });
        state.getEnergy().discardAll(owner, instanceId);
        if (position.isActive()) {
            state.getStatuses().clear(owner);
        }
        state.getPassiveEffects().clearForInstance(instanceId);

        PlayerState scorer = state.getPlayer(opponent);
        scorer.addPoints(points);
        logger.info("{} is knocked out for {} points; player {} has {} points",
                card, points, opponent, scorer.getPoints());

        if (scorer.getPoints() >= state.getConfig().getPointsToWin()) {
            declareWinner(state, opponent, "reached " + scorer.getPoints() + " points");
        } else if (ownerState.getField().isEmpty()) {
            declareWinner(state, opponent, "player " + owner + " has no creatures left");
        } else if (!ownerState.getField().hasActive()) {
            state.getTurnState().addAwaitingActive(owner);
            logger.debug("Player {} must promote a new active creature", owner);
        }
    }

    /**
     * Points for knocking out a creature, read from its current form: 3 for a mega ex,
     * 2 for an ex, 1 otherwise.
     */
    static int pointsFor(CreatureCard creature) {
        CreatureAttributes attributes = creature.getAttributes();
        if (attributes == null || !attributes.isEx() && !attributes.isMega()) {
            return 1;
        }
        return attributes.isMega() ? 3 : 2;
    }

    private static void declareWinner(GameState state, int player, String reason) {
        state.setWinner(player);
        state.getEffectQueue().clear();
        logger.info("Player {} wins: {}", player, reason);
    }

    private static List<String> knockedOutInstances(GameState state) {
        List<String> ids = new ArrayList<>();
        int current = state.getCurrentPlayer();
        for (int player : new int[]{current, GameState.opponentOf(current)}) {
            for (int index : state.getPlayer(player).getField().occupiedIndices()) {
                FieldPosition position = new FieldPosition(player, index);
                if (isKnockedOut(state, position)) {
                    ids.add(state.requireFieldCard(position).getFieldInstanceId());
                }
            }
        }
        return ids;
    }
}
