package com.creaturebattle.game;

import com.creaturebattle.card.effect.StatusCondition;

/**
 * A condition on an active creature and the turn it was applied.
 */
public record AppliedStatus(StatusCondition condition, int appliedTurn) {
}
