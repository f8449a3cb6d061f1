package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * One or both players, relative to the effect's owner.
 */
public enum PlayerScope {
    SELF("self"),
    OPPONENT("opponent"),
    BOTH("both");

    private final String jsonValue;

    PlayerScope(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public boolean includes(int sourcePlayer, int player) {
        return switch (this) {
            case SELF -> player == sourcePlayer;
            case OPPONENT -> player != sourcePlayer;
            case BOTH -> true;
        };
    }

    /**
     * Absolute player ids in scope, owner first.
     */
    public List<Integer> players(int sourcePlayer) {
        return switch (this) {
            case SELF -> List.of(sourcePlayer);
            case OPPONENT -> List.of(1 - sourcePlayer);
            case BOTH -> List.of(sourcePlayer, 1 - sourcePlayer);
        };
    }
}
