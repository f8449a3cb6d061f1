package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Limits on which creatures an evolution effect may evolve.
 */
public enum EvolutionRestriction {
    BASIC_CREATURE_ONLY("basic-creature-only");

    private final String jsonValue;

    EvolutionRestriction(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
