package com.creaturebattle.game.action;

/**
 * Something a player asks the engine to do. Bench indices are 0-based positions on the
 * bench; field indices count the active spot as 0.
 */
public sealed interface Action permits Action.PlayCard, Action.AttachEnergy, Action.Attack, Action.Evolve,
        Action.Retreat, Action.UseAbility, Action.SelectTarget, Action.SelectActive, Action.EndTurn {

    /**
     * Play the hand card at {@code handIndex}. {@code fieldIndex} picks the creature a tool
     * goes on and defaults to the active; other card kinds ignore it.
     */
    record PlayCard(int handIndex, Integer fieldIndex) implements Action {
        public PlayCard(int handIndex) {
            this(handIndex, null);
        }
    }

    /**
     * Attach this turn's generated energy to the creature at {@code fieldIndex}.
     */
    record AttachEnergy(int fieldIndex) implements Action {
    }

    record Attack(int attackIndex) implements Action {
    }

    record Evolve(int handIndex, int fieldIndex) implements Action {
    }

    record Retreat(int benchIndex) implements Action {
    }

    record UseAbility(int fieldIndex) implements Action {
    }

    /**
     * Answer a pending selection with the creature at {@code fieldIndex} on {@code playerId}'s field.
     */
    record SelectTarget(int playerId, int fieldIndex) implements Action {
    }

    /**
     * Promote a bench creature into an empty active spot after a knockout.
     */
    record SelectActive(int benchIndex) implements Action {
    }

    record EndTurn() implements Action {
    }
}
