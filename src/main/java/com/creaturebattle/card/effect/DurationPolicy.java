package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifetime of a passive effect.
 * <ul>
 *   <li>UNTIL_END_OF_TURN: gone once the turn it was created in ends.</li>
 *   <li>UNTIL_END_OF_NEXT_TURN: survives the following (opponent's) turn.</li>
 *   <li>WHILE_IN_PLAY: until the source creature leaves the field.</li>
 *   <li>WHILE_ATTACHED: until the granting tool is detached.</li>
 * </ul>
 */
public enum DurationPolicy {
    UNTIL_END_OF_TURN("until-end-of-turn"),
    UNTIL_END_OF_NEXT_TURN("until-end-of-next-turn"),
    WHILE_IN_PLAY("while-in-play"),
    WHILE_ATTACHED("while-attached");

    private final String jsonValue;

    DurationPolicy(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public boolean isTurnBound() {
        return this == UNTIL_END_OF_TURN || this == UNTIL_END_OF_NEXT_TURN;
    }
}
