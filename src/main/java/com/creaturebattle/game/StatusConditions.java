package com.creaturebattle.game;

import com.creaturebattle.card.effect.StatusCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Special conditions on each player's active creature.
 * Sleep, confusion and paralysis exclude each other; burn and poison stack with them.
 */
public class StatusConditions {
    private static final Logger logger = LoggerFactory.getLogger(StatusConditions.class);

    private final List<List<AppliedStatus>> conditions = List.of(new ArrayList<>(), new ArrayList<>());

    /**
     * Apply a condition. Re-applying refreshes its applied turn; an exclusive condition
     * replaces any other exclusive one.
     */
    public void apply(int player, StatusCondition condition, int turn) {
        List<AppliedStatus> current = conditions.get(player);
        current.removeIf(s -> s.condition() == condition
                || (condition.isExclusive() && s.condition().isExclusive()));
        current.add(new AppliedStatus(condition, turn));
        logger.debug("Player {} active is now {}", player, condition.getJsonValue());
    }

    public boolean remove(int player, StatusCondition condition) {
        return conditions.get(player).removeIf(s -> s.condition() == condition);
    }

    /**
     * Remove the given conditions, or all of them when {@code which} is empty.
     * @return how many were removed
     */
    public int removeAll(int player, Collection<StatusCondition> which) {
        List<AppliedStatus> current = conditions.get(player);
        int before = current.size();
        if (which.isEmpty()) {
            current.clear();
        } else {
            current.removeIf(s -> which.contains(s.condition()));
        }
        return before - current.size();
    }

    public void clear(int player) {
        conditions.get(player).clear();
    }

    public boolean has(int player, StatusCondition condition) {
        return conditions.get(player).stream().anyMatch(s -> s.condition() == condition);
    }

    public List<AppliedStatus> get(int player) {
        return List.copyOf(conditions.get(player));
    }

    public boolean canAttack(int player) {
        return conditions.get(player).stream().noneMatch(s -> s.condition().isIncapacitating());
    }

    public boolean canRetreat(int player) {
        return canAttack(player);
    }
}
