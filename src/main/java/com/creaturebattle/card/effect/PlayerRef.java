package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A player named relative to whoever owns the effect.
 */
public enum PlayerRef {
    SELF("self"),
    OPPONENT("opponent");

    private final String jsonValue;

    PlayerRef(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Absolute player id, given the id of the player who owns the effect.
     */
    public int resolve(int sourcePlayer) {
        return this == SELF ? sourcePlayer : 1 - sourcePlayer;
    }
}
