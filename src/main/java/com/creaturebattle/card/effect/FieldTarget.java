package com.creaturebattle.card.effect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Which field creatures an effect acts on.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = FieldTarget.Fixed.class, name = "fixed"),
    @JsonSubTypes.Type(value = FieldTarget.Resolved.class, name = "resolved"),
    @JsonSubTypes.Type(value = FieldTarget.SingleChoice.class, name = "single-choice"),
    @JsonSubTypes.Type(value = FieldTarget.AllMatching.class, name = "all-matching")
})
public sealed interface FieldTarget permits FieldTarget.Fixed, FieldTarget.Resolved,
        FieldTarget.SingleChoice, FieldTarget.AllMatching {

    /**
     * A named slot. {@code benchIndex} is zero-based and only read for BENCH.
     */
    record Fixed(
            @JsonProperty("player") PlayerRef player,
            @JsonProperty("position") FixedPosition position,
            @JsonProperty("bench_index") Integer benchIndex) implements FieldTarget {

        public static Fixed activeOf(PlayerRef player) {
            return new Fixed(player, FixedPosition.ACTIVE, null);
        }

        public static Fixed source() {
            return new Fixed(PlayerRef.SELF, FixedPosition.SOURCE, null);
        }
    }

    record Resolved(@JsonProperty("targets") List<FieldPosition> targets) implements FieldTarget {
    }

    /**
     * One creature among those matching {@code criteria}, picked by {@code chooser}.
     */
    record SingleChoice(
            @JsonProperty("chooser") PlayerRef chooser,
            @JsonProperty("criteria") FieldTargetCriteria criteria) implements FieldTarget {
    }

    record AllMatching(@JsonProperty("criteria") FieldTargetCriteria criteria) implements FieldTarget {
    }
}
