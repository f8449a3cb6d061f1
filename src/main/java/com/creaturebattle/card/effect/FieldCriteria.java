package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Criteria on a creature as it currently sits on the field.
 *
 * @param cardCriteria printed-data criteria for the current form
 * @param hasDamage    true: damageTaken &gt; 0, false: undamaged
 * @param hasEnergy    minimum attached count per energy type name
 */
public record FieldCriteria(
        @JsonProperty("card_criteria") CreatureCriteria cardCriteria,
        @JsonProperty("has_damage") Boolean hasDamage,
        @JsonProperty("has_energy") Map<String, Integer> hasEnergy) {

    public static FieldCriteria damaged() {
        return new FieldCriteria(null, true, null);
    }
}
