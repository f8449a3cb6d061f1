package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a count amount aggregates over.
 */
public enum CountType {
    FIELD("field"),
    CARD("card"),
    ENERGY("energy"),
    DAMAGE("damage");

    private final String jsonValue;

    CountType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
