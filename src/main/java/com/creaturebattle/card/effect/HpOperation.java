package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of an hp effect.
 */
public enum HpOperation {
    HEAL("heal"),
    DAMAGE("damage");

    private final String jsonValue;

    HpOperation(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
