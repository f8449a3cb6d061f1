package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-player quantities a player-context amount can read.
 */
public enum ContextSource {
    HAND_SIZE("hand-size"),
    CURRENT_POINTS("current-points"),
    POINTS_TO_WIN("points-to-win");

    private final String jsonValue;

    ContextSource(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
