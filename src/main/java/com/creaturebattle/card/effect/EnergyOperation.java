package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of an energy effect.
 */
public enum EnergyOperation {
    ATTACH("attach"),
    DISCARD("discard");

    private final String jsonValue;

    EnergyOperation(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
