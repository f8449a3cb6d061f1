package com.creaturebattle.simulation;

import com.creaturebattle.card.Attack;
import com.creaturebattle.card.Card;
import com.creaturebattle.card.TriggerType;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.PendingSelection;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.PlayerState;
import com.creaturebattle.game.action.Action;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.game.zones.FieldCard;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Simple greedy policy used by the demo game.
 */
public final class DecisionEngine {

    private DecisionEngine() {
        // Utility class - no instantiation
    }

    /**
     * Actions worth trying for {@code player}, best first. The caller tries them in order
     * and falls back to ending the turn when none is accepted.
     * Priority:
     * 1. Answer a pending selection (first candidate) or promote the first bench creature
     * 2. Play basic creatures
     * 3. Evolve
     * 4. Attach energy to the active creature
     * 5. Play trainers and tools, then manual abilities
     * 6. Attack with the strongest attack last in the list of attacks
     *
     * @param state  Current game state
     * @param player The player to act
     * @return Candidate actions in priority order
     */
    public static List<Action> candidateActions(GameState state, int player) {
        List<Action> actions = new ArrayList<>();
        Optional<PendingSelection> pending = state.getTurnState().getPendingSelection();
        if (pending.isPresent()) {
            if (pending.get().chooser() == player) {
                FieldPosition first = pending.get().candidates().get(0);
                actions.add(new Action.SelectTarget(first.playerId(), first.fieldIndex()));
            }
            return actions;
        }
        if (state.getTurnState().isAwaitingActive(player)) {
            actions.add(new Action.SelectActive(0));
            return actions;
        }

        PlayerState self = state.getPlayer(player);
        List<CardInstance> hand = self.getHand().getCards();
        for (int i = 0; i < hand.size(); i++) {
            Card card = state.getRepository().require(hand.get(i).templateId());
            if (card instanceof Card.Creature creature && creature.isBasic()) {
                actions.add(new Action.PlayCard(i));
            }
        }
        for (int i = 0; i < hand.size(); i++) {
            Card card = state.getRepository().require(hand.get(i).templateId());
            if (card instanceof Card.Creature creature && !creature.isBasic()) {
                for (int fieldIndex : self.getField().occupiedIndices()) {
                    FieldCard base = self.getField().require(fieldIndex);
                    if (creature.getEvolvesFrom().equals(state.creatureData(base).getName())) {
                        actions.add(new Action.Evolve(i, fieldIndex));
                    }
                }
            }
        }
        if (self.getField().hasActive()) {
            actions.add(new Action.AttachEnergy(0));
        }
        for (int i = 0; i < hand.size(); i++) {
            Card card = state.getRepository().require(hand.get(i).templateId());
            if (!(card instanceof Card.Creature)) {
                actions.add(new Action.PlayCard(i));
            }
        }
        for (int fieldIndex : self.getField().occupiedIndices()) {
            Card.Creature data = state.creatureData(self.getField().require(fieldIndex));
            if (data.hasAbility() && data.getAbility().getTrigger() != null
                    && data.getAbility().getTrigger().getType() == TriggerType.MANUAL) {
                actions.add(new Action.UseAbility(fieldIndex));
            }
        }
        self.getField().getActive().ifPresent(active -> {
            List<Attack> attacks = state.creatureData(active).getAttacks();
            for (int i = attacks.size() - 1; i >= 0; i--) {
                actions.add(new Action.Attack(i));
            }
        });
        return actions;
    }
}
