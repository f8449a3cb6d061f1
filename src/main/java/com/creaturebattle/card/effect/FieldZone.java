package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Active or bench half of a field.
 */
public enum FieldZone {
    ACTIVE("active"),
    BENCH("bench");

    private final String jsonValue;

    FieldZone(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
