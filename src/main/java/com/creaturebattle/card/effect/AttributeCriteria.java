package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Attribute flags a creature must (true) or must not (false) carry. Null flags are ignored.
 */
public record AttributeCriteria(
        @JsonProperty("ex") Boolean ex,
        @JsonProperty("mega") Boolean mega,
        @JsonProperty("ultra_beast") Boolean ultraBeast) {
}
