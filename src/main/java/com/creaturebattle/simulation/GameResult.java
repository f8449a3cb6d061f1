package com.creaturebattle.simulation;

import java.util.List;

/**
 * Result of a single demo game.
 *
 * @param winner          winning player, or null if the turn limit was reached first
 * @param turns           turn number the game stopped on
 * @param executedActions accepted actions
 * @param points          points per player
 */
public record GameResult(Integer winner, int turns, int executedActions, List<Integer> points) {

    public boolean hasWinner() {
        return winner != null;
    }
}
