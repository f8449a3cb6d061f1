package com.creaturebattle.game;

import com.creaturebattle.card.Card;
import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.game.zones.FieldCard;
import com.creaturebattle.trigger.GameEvent;
import com.creaturebattle.trigger.TriggerDispatcher;

/**
 * Evolution lines and the state changes of evolving a creature in play.
 */
public final class EvolutionRules {

    private EvolutionRules() {
        // Utility class - prevent instantiation
    }

    /**
     * Whether {@code evolution} sits exactly {@code stages} stages above a creature named
     * {@code baseName}, following evolves-from names back through the repository.
     */
    public static boolean descendsFrom(CardRepository repository, Card.Creature evolution, String baseName,
                                       int stages) {
        if (stages < 1 || evolution.isBasic()) {
            return false;
        }
        if (stages == 1) {
            return evolution.getEvolvesFrom().equals(baseName);
        }
        for (Card.Creature previous : repository.getCreaturesNamed(evolution.getEvolvesFrom())) {
            if (descendsFrom(repository, previous, baseName, stages - 1)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the creature may evolve now: it was neither played nor evolved this turn.
     */
    public static boolean canEvolveNow(GameState state, FieldCard card) {
        return card.getTurnLastPlayed() != state.getTurn()
                && !state.getTurnState().hasEvolved(card.getFieldInstanceId());
    }

    /**
     * Put {@code evolution} on top of the creature at {@code position}. Damage, energy and
     * the tool stay; an active creature loses its special conditions. Fires the
     * creature's played trigger.
     */
    public static void evolve(GameState state, FieldPosition position, CardInstance evolution) {
        FieldCard target = state.requireFieldCard(position);
        target.evolve(evolution, state.getTurn());
        state.getTurnState().markEvolved(target.getFieldInstanceId());
        if (position.isActive()) {
            state.getStatuses().clear(position.playerId());
        }
        TriggerDispatcher.onEvent(state, new GameEvent.Played(position.playerId(), target.getFieldInstanceId(), true));
    }
}
