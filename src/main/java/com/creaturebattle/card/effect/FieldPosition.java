package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An absolute field slot: a player id and a field index (0 = active).
 */
public record FieldPosition(
        @JsonProperty("player_id") int playerId,
        @JsonProperty("field_index") int fieldIndex) {

    public boolean isActive() {
        return fieldIndex == 0;
    }

    @Override
    public String toString() {
        return "P" + playerId + "[" + fieldIndex + "]";
    }
}
