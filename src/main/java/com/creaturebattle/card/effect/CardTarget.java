package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A pile of cards belonging to one player, optionally narrowed by criteria.
 */
public record CardTarget(
        @JsonProperty("player") PlayerRef player,
        @JsonProperty("location") CardLocation location,
        @JsonProperty("criteria") CardCriteria criteria) {
}
