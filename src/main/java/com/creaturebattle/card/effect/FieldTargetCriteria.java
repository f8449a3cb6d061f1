package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Which field creatures a target or passive applies to. {@code player} is relative to
 * the effect's owner; any null part matches everything.
 */
public record FieldTargetCriteria(
        @JsonProperty("player") PlayerRef player,
        @JsonProperty("position") FieldZone position,
        @JsonProperty("field_criteria") FieldCriteria fieldCriteria) {

    public static FieldTargetCriteria of(PlayerRef player, FieldZone position) {
        return new FieldTargetCriteria(player, position, null);
    }

    public static FieldTargetCriteria any() {
        return new FieldTargetCriteria(null, null, null);
    }
}
