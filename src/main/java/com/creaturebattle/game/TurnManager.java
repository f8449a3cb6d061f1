package com.creaturebattle.game;

import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.StatusCondition;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.DamageRules;
import com.creaturebattle.effect.DrainStatus;
import com.creaturebattle.effect.EffectQueue;
import com.creaturebattle.trigger.GameEvent;
import com.creaturebattle.trigger.TriggerDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manages the transition from one player's turn to the next.
 */
public final class TurnManager {
    private static final Logger logger = LoggerFactory.getLogger(TurnManager.class);

    private TurnManager() {
        // Utility class - prevent instantiation
    }

    /**
     * End the current player's turn and start the opponent's.
     *
     * End-of-turn triggers and checkup each drain the effect queue. If either drain stops
     * for a target selection, the transition pauses; call this again once the queue is
     * idle and it continues from the stage it reached.
     *
     * @param state The current game state
     * @return AWAITING_SELECTION if the transition is paused on a selection
     */
    public static DrainStatus endTurn(GameState state) {
        TurnState turnState = state.getTurnState();
        int ending = state.getCurrentPlayer();

        if (turnState.getEndTurnStage() == TurnState.EndTurnStage.NONE) {
            logger.debug("Ending turn {} for player {}", state.getTurn(), ending);
            turnState.setEndTurnStage(TurnState.EndTurnStage.END_OF_TURN_FIRED);
            TriggerDispatcher.onEvent(state, new GameEvent.EndOfTurn(ending));
        }
        if (turnState.getEndTurnStage() == TurnState.EndTurnStage.END_OF_TURN_FIRED) {
            if (EffectQueue.drain(state) == DrainStatus.AWAITING_SELECTION) {
                return DrainStatus.AWAITING_SELECTION;
            }
            turnState.setEndTurnStage(TurnState.EndTurnStage.CHECKUP_FIRED);
            TriggerDispatcher.onEvent(state, new GameEvent.Checkup(ending));
            checkup(state, ending);
            checkup(state, GameState.opponentOf(ending));
        }
        if (EffectQueue.drain(state) == DrainStatus.AWAITING_SELECTION) {
            return DrainStatus.AWAITING_SELECTION;
        }
        if (KnockoutProcessor.processKnockouts(state) == DrainStatus.AWAITING_SELECTION) {
            return DrainStatus.AWAITING_SELECTION;
        }
        turnState.setEndTurnStage(TurnState.EndTurnStage.NONE);
        if (state.isGameOver()) {
            return DrainStatus.IDLE;
        }
        return startNextTurn(state);
    }

    /**
     * Between-turns status handling for one player's active creature.
     *
     * Poison and burn deal their configured damage. Sleep and burn each go away on heads.
     * Paralysis wears off at its owner's own checkup once the turn it was applied in is over.
     *
     * @param state  The current game state
     * @param player Owner of the active creature
     */
    static void checkup(GameState state, int player) {
        FieldPosition active = new FieldPosition(player, 0);
        if (state.fieldCardAt(active).isEmpty()) {
            return;
        }
        StatusConditions statuses = state.getStatuses();
        if (statuses.has(player, StatusCondition.POISON)) {
            dealCheckupDamage(state, active, state.getConfig().getPoisonDamage(), "poison");
        }
        if (statuses.has(player, StatusCondition.BURN)) {
            dealCheckupDamage(state, active, state.getConfig().getBurnDamage(), "burn");
        }
        if (statuses.has(player, StatusCondition.SLEEP) && state.getCoinFlipper().flip()) {
            statuses.remove(player, StatusCondition.SLEEP);
            logger.debug("Player {} active wakes up", player);
        }
        if (statuses.has(player, StatusCondition.BURN) && state.getCoinFlipper().flip()) {
            statuses.remove(player, StatusCondition.BURN);
            logger.debug("Player {} active is no longer burned", player);
        }
        if (player == state.getCurrentPlayer()) {
            int turn = state.getTurn();
            boolean paralysisOver = statuses.get(player).stream()
                    .anyMatch(s -> s.condition() == StatusCondition.PARALYSIS && s.appliedTurn() < turn);
            if (paralysisOver) {
                statuses.remove(player, StatusCondition.PARALYSIS);
                logger.debug("Player {} active is no longer paralyzed", player);
            }
        }
    }

    private static void dealCheckupDamage(GameState state, FieldPosition active, int amount, String cause) {
        ApplyResult result = DamageRules.applyDamage(state, active, amount);
        logger.debug("{} deals {} to {}", cause, result.amountApplied(), active);
        for (GameEvent event : result.events()) {
            TriggerDispatcher.onEvent(state, event);
        }
    }

    private static DrainStatus startNextTurn(GameState state) {
        state.advanceTurn();
        int player = state.getCurrentPlayer();
        state.getPassiveEffects().expire(state.getTurn());
        state.getTurnState().startTurn();
        state.getEnergy().resetTurnFlags(player);
        state.getCoinFlipper().clearGuaranteedHeads();

        int drawn = state.drawCards(player, 1);
        if (drawn == 0) {
            logger.debug("Player {} has no cards left to draw", player);
        }
        state.getEnergy().generate(player, state.getRng());
        logger.info("Turn {} begins for player {} (energy: {})", state.getTurn(), player,
                state.getEnergy().getCurrentEnergy(player));

        TriggerDispatcher.onEvent(state, new GameEvent.StartOfTurn(player));
        if (EffectQueue.drain(state) == DrainStatus.AWAITING_SELECTION) {
            return DrainStatus.AWAITING_SELECTION;
        }
        return KnockoutProcessor.processKnockouts(state);
    }
}
