package com.creaturebattle.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Game events an ability or tool can be bound to.
 */
public enum TriggerType {
    END_OF_TURN("end-of-turn"),
    START_OF_TURN("start-of-turn"),
    ON_CHECKUP("on-checkup"),
    DAMAGED("damaged"),
    ENERGY_ATTACHMENT("energy-attachment"),
    ON_PLAY("on-play"),
    BEFORE_KNOCKOUT("before-knockout"),
    ON_RETREAT("on-retreat"),
    MANUAL("manual");

    private final String jsonValue;

    TriggerType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
