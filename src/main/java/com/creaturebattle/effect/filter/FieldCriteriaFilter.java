package com.creaturebattle.effect.filter;

import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.FieldCriteria;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.zones.FieldCard;

import java.util.Map;

/**
 * Matches a creature in play against {@link FieldCriteria}: printed data of its current
 * form, whether it is damaged, and minimum attached energy.
 */
public final class FieldCriteriaFilter {

    private FieldCriteriaFilter() {
    }

    public static boolean matches(GameState state, FieldCriteria criteria, FieldCard card) {
        if (criteria == null) {
            return true;
        }
        if (criteria.hasDamage() != null && criteria.hasDamage() != card.isDamaged()) {
            return false;
        }
        if (criteria.hasEnergy() != null) {
            for (Map.Entry<String, Integer> entry : criteria.hasEnergy().entrySet()) {
                EnergyType type = EnergyType.fromString(entry.getKey());
                int present = type == EnergyType.COLORLESS
                        ? state.getEnergy().total(card.getFieldInstanceId())
                        : state.getEnergy().count(card.getFieldInstanceId(), type);
                if (present < entry.getValue()) {
                    return false;
                }
            }
        }
        return CreatureCriteriaFilter.matches(criteria.cardCriteria(), state.creatureData(card));
    }
}
