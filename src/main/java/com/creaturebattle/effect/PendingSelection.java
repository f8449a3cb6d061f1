package com.creaturebattle.effect;

import com.creaturebattle.card.effect.FieldPosition;

import java.util.List;
import java.util.Map;

/**
 * Checkpoint for an effect that is waiting for a player to pick a field target.
 *
 * @param queued     the suspended effect and its original context
 * @param role       the role still to be filled
 * @param chooser    absolute id of the player who must choose
 * @param candidates the legal choices
 * @param choices    positions already fixed for earlier roles
 */
public record PendingSelection(
        QueuedEffect queued,
        SelectionRole role,
        int chooser,
        List<FieldPosition> candidates,
        Map<SelectionRole, List<FieldPosition>> choices) {

    public PendingSelection {
        candidates = List.copyOf(candidates);
        choices = Map.copyOf(choices);
    }

    public boolean accepts(int player, FieldPosition position) {
        return player == chooser && candidates.contains(position);
    }
}
