package com.creaturebattle.effect.filter;

import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.FieldTargetCriteria;
import com.creaturebattle.card.effect.FieldZone;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.zones.FieldCard;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Matches field positions against {@link FieldTargetCriteria}. The criteria's player is
 * read relative to {@code sourcePlayer}.
 */
public final class FieldTargetCriteriaFilter {

    private FieldTargetCriteriaFilter() {
    }

    public static boolean matches(GameState state, FieldTargetCriteria criteria, int sourcePlayer,
                                  FieldPosition position) {
        Optional<FieldCard> card = state.fieldCardAt(position);
        if (card.isEmpty()) {
            return false;
        }
        if (criteria == null) {
            return true;
        }
        if (criteria.player() != null && criteria.player().resolve(sourcePlayer) != position.playerId()) {
            return false;
        }
        if (criteria.position() == FieldZone.ACTIVE && !position.isActive()) {
            return false;
        }
        if (criteria.position() == FieldZone.BENCH && position.isActive()) {
            return false;
        }
        return FieldCriteriaFilter.matches(state, criteria.fieldCriteria(), card.get());
    }

    /**
     * Every occupied position that matches, source player first, each in field order.
     */
    public static List<FieldPosition> matching(GameState state, FieldTargetCriteria criteria, int sourcePlayer) {
        List<FieldPosition> result = new ArrayList<>();
        for (int player : new int[] {sourcePlayer, GameState.opponentOf(sourcePlayer)}) {
            for (int index : state.getPlayer(player).getField().occupiedIndices()) {
                FieldPosition position = new FieldPosition(player, index);
                if (matches(state, criteria, sourcePlayer, position)) {
                    result.add(position);
                }
            }
        }
        return result;
    }
}
