package com.creaturebattle.effect;

import com.creaturebattle.trigger.GameEvent;

import java.util.List;

/**
 * What applying an effect did: the amount that actually took effect (damage dealt, cards
 * drawn, energy moved, ...) and the events to dispatch as triggers.
 */
public record ApplyResult(int amountApplied, List<GameEvent> events) {

    public ApplyResult {
        events = List.copyOf(events);
    }

    public static ApplyResult none() {
        return new ApplyResult(0, List.of());
    }

    public static ApplyResult of(int amountApplied) {
        return new ApplyResult(amountApplied, List.of());
    }
}
