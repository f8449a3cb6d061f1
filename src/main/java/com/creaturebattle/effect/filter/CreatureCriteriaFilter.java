package com.creaturebattle.effect.filter;

import com.creaturebattle.card.Card;
import com.creaturebattle.card.CreatureAttributes;
import com.creaturebattle.card.effect.AttributeCriteria;
import com.creaturebattle.card.effect.CreatureCriteria;

/**
 * Matches a creature's printed data against {@link CreatureCriteria}.
 */
public final class CreatureCriteriaFilter {

    private CreatureCriteriaFilter() {
    }

    public static boolean matches(CreatureCriteria criteria, Card.Creature creature) {
        if (criteria == null) {
            return true;
        }
        if (criteria.names() != null && !criteria.names().isEmpty()
                && !criteria.names().contains(creature.getName())) {
            return false;
        }
        if (criteria.stage() != null && criteria.stage() != creature.getStage()) {
            return false;
        }
        if (criteria.previousStageName() != null
                && !criteria.previousStageName().equalsIgnoreCase(creature.getEvolvesFrom())) {
            return false;
        }
        if (criteria.isType() != null && criteria.isType() != creature.getType()) {
            return false;
        }
        return matchesAttributes(criteria.attributes(), creature.getAttributes());
    }

    private static boolean matchesAttributes(AttributeCriteria wanted, CreatureAttributes actual) {
        if (wanted == null) {
            return true;
        }
        CreatureAttributes attributes = actual != null ? actual : new CreatureAttributes();
        return flagMatches(wanted.ex(), attributes.isEx())
                && flagMatches(wanted.mega(), attributes.isMega())
                && flagMatches(wanted.ultraBeast(), attributes.isUltraBeast());
    }

    private static boolean flagMatches(Boolean wanted, boolean actual) {
        return wanted == null || wanted == actual;
    }
}
