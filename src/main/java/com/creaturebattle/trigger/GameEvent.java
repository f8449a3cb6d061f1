package com.creaturebattle.trigger;

import com.creaturebattle.card.EnergyType;

/**
 * Things that happen during a game and can fire triggers. Instance ids are field
 * instance ids.
 */
public sealed interface GameEvent permits GameEvent.EndOfTurn, GameEvent.StartOfTurn, GameEvent.Checkup,
        GameEvent.Damaged, GameEvent.KnockoutThreatened, GameEvent.EnergyAttached, GameEvent.Played,
        GameEvent.BeforeKnockout, GameEvent.Retreated {

    record EndOfTurn(int player) implements GameEvent {
    }

    record StartOfTurn(int player) implements GameEvent {
    }

    record Checkup(int player) implements GameEvent {
    }

    record Damaged(int player, String instanceId, int amount) implements GameEvent {
    }

    /**
     * Damage brought a creature to zero remaining HP. Knockout processing picks it up.
     */
    record KnockoutThreatened(int player, String instanceId) implements GameEvent {
    }

    record EnergyAttached(int player, String instanceId, EnergyType energyType) implements GameEvent {
    }

    record Played(int player, String instanceId, boolean viaEvolution) implements GameEvent {
    }

    record BeforeKnockout(int player, String instanceId) implements GameEvent {
    }

    record Retreated(int player, String instanceId) implements GameEvent {
    }
}
