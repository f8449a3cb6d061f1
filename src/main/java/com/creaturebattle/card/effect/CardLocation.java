package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Zones a card can be counted or searched in.
 */
public enum CardLocation {
    HAND("hand"),
    DECK("deck"),
    DISCARD("discard"),
    FIELD("field");

    private final String jsonValue;

    CardLocation(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
