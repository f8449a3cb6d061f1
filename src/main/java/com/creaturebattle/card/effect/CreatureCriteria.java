package com.creaturebattle.card.effect;

import com.creaturebattle.card.EnergyType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Criteria on a creature's printed data.
 *
 * @param names             any of these names
 * @param stage             exact evolution stage (0, 1 or 2)
 * @param previousStageName the name it evolves from, compared case-insensitively
 * @param isType            the creature's energy type
 * @param attributes        ex / mega / ultra beast flags
 */
public record CreatureCriteria(
        @JsonProperty("names") List<String> names,
        @JsonProperty("stage") Integer stage,
        @JsonProperty("previous_stage_name") String previousStageName,
        @JsonProperty("is_type") EnergyType isType,
        @JsonProperty("attributes") AttributeCriteria attributes) {
}
