package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Special conditions that can sit on an active creature.
 */
public enum StatusCondition {
    SLEEP("sleep"),
    BURN("burn"),
    CONFUSION("confusion"),
    PARALYSIS("paralysis"),
    POISON("poison");

    private final String jsonValue;

    StatusCondition(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Sleep, confusion and paralysis replace each other; burn and poison stack with anything.
     */
    public boolean isExclusive() {
        return this == SLEEP || this == CONFUSION || this == PARALYSIS;
    }

    /**
     * Whether this condition stops the creature from attacking and retreating.
     */
    public boolean isIncapacitating() {
        return this == SLEEP || this == PARALYSIS;
    }
}
