package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Positions a fixed target can name. SOURCE is the creature the effect came from.
 */
public enum FixedPosition {
    ACTIVE("active"),
    SOURCE("source"),
    BENCH("bench");

    private final String jsonValue;

    FixedPosition(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
