package com.creaturebattle.card.effect;

import com.creaturebattle.card.EnergyType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A numeric amount, either literal or computed from game state when the effect resolves.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = AmountSpec.Constant.class, name = "constant"),
    @JsonSubTypes.Type(value = AmountSpec.PlayerContext.class, name = "player-context"),
    @JsonSubTypes.Type(value = AmountSpec.Count.class, name = "count"),
    @JsonSubTypes.Type(value = AmountSpec.Addition.class, name = "addition"),
    @JsonSubTypes.Type(value = AmountSpec.Multiplication.class, name = "multiplication"),
    @JsonSubTypes.Type(value = AmountSpec.Conditional.class, name = "conditional"),
    @JsonSubTypes.Type(value = AmountSpec.CoinFlip.class, name = "coin-flip")
})
public sealed interface AmountSpec permits AmountSpec.Constant, AmountSpec.PlayerContext, AmountSpec.Count,
        AmountSpec.Addition, AmountSpec.Multiplication, AmountSpec.Conditional, AmountSpec.CoinFlip {

    static AmountSpec of(int value) {
        return new Constant(value);
    }

    record Constant(@JsonProperty("value") int value) implements AmountSpec {
    }

    record PlayerContext(
            @JsonProperty("source") ContextSource source,
            @JsonProperty("player") PlayerRef player) implements AmountSpec {
    }

    /**
     * Aggregate over the field or a card pile.
     * <ul>
     *   <li>field: creatures matching {@code criteria}</li>
     *   <li>card: cards of {@code player} in {@code location} matching {@code cardCriteria}</li>
     *   <li>energy: attached energy of {@code energyTypes} (all if empty) on matching creatures</li>
     *   <li>damage: damage taken by matching creatures</li>
     * </ul>
     */
    record Count(
            @JsonProperty("count_type") CountType countType,
            @JsonProperty("criteria") FieldTargetCriteria criteria,
            @JsonProperty("energy_types") List<EnergyType> energyTypes,
            @JsonProperty("player") PlayerRef player,
            @JsonProperty("location") CardLocation location,
            @JsonProperty("card_criteria") CardCriteria cardCriteria) implements AmountSpec {

        public static Count field(FieldTargetCriteria criteria) {
            return new Count(CountType.FIELD, criteria, null, null, null, null);
        }

        public static Count energy(FieldTargetCriteria criteria, List<EnergyType> energyTypes) {
            return new Count(CountType.ENERGY, criteria, energyTypes, null, null, null);
        }

        public static Count damage(FieldTargetCriteria criteria) {
            return new Count(CountType.DAMAGE, criteria, null, null, null, null);
        }

        public static Count cards(PlayerRef player, CardLocation location, CardCriteria cardCriteria) {
            return new Count(CountType.CARD, null, null, player, location, cardCriteria);
        }
    }

    record Addition(@JsonProperty("values") List<AmountSpec> values) implements AmountSpec {
    }

    record Multiplication(
            @JsonProperty("base") AmountSpec base,
            @JsonProperty("multiplier") AmountSpec multiplier) implements AmountSpec {
    }

    /**
     * {@code trueValue} if the source creature matches {@code condition}, else {@code falseValue}.
     */
    record Conditional(
            @JsonProperty("condition") FieldCriteria condition,
            @JsonProperty("true_value") AmountSpec trueValue,
            @JsonProperty("false_value") AmountSpec falseValue) implements AmountSpec {
    }

    /**
     * Sum of {@code headsValue} per head and {@code tailsValue} per tail over {@code flipCount} flips.
     */
    record CoinFlip(
            @JsonProperty("heads_value") AmountSpec headsValue,
            @JsonProperty("tails_value") AmountSpec tailsValue,
            @JsonProperty("flip_count") Integer flipCount) implements AmountSpec {
    }
}
