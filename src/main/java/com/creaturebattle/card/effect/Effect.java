package com.creaturebattle.card.effect;

import com.creaturebattle.card.CardType;
import com.creaturebattle.card.EnergyType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Declarative card effect.
 * Uses Jackson polymorphic deserialization based on the "type" field. Immediate kinds change
 * state when applied; {@link Modifier} kinds register a passive effect for their duration.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Effect.Hp.class, name = "hp"),
    @JsonSubTypes.Type(value = Effect.Status.class, name = "status"),
    @JsonSubTypes.Type(value = Effect.StatusRecovery.class, name = "status-recovery"),
    @JsonSubTypes.Type(value = Effect.Draw.class, name = "draw"),
    @JsonSubTypes.Type(value = Effect.Energy.class, name = "energy"),
    @JsonSubTypes.Type(value = Effect.EnergyTransfer.class, name = "energy-transfer"),
    @JsonSubTypes.Type(value = Effect.Search.class, name = "search"),
    @JsonSubTypes.Type(value = Effect.Shuffle.class, name = "shuffle"),
    @JsonSubTypes.Type(value = Effect.HandDiscard.class, name = "hand-discard"),
    @JsonSubTypes.Type(value = Effect.Switch.class, name = "switch"),
    @JsonSubTypes.Type(value = Effect.ToolDiscard.class, name = "tool-discard"),
    @JsonSubTypes.Type(value = Effect.EndTurn.class, name = "end-turn"),
    @JsonSubTypes.Type(value = Effect.CoinFlipManipulation.class, name = "coin-flip-manipulation"),
    @JsonSubTypes.Type(value = Effect.EvolutionAcceleration.class, name = "evolution-acceleration"),
    @JsonSubTypes.Type(value = Effect.PullEvolution.class, name = "pull-evolution"),
    @JsonSubTypes.Type(value = Effect.SwapCards.class, name = "swap-cards"),
    @JsonSubTypes.Type(value = Effect.DamageBoost.class, name = "damage-boost"),
    @JsonSubTypes.Type(value = Effect.DamageReduction.class, name = "damage-reduction"),
    @JsonSubTypes.Type(value = Effect.PreventDamage.class, name = "prevent-damage"),
    @JsonSubTypes.Type(value = Effect.HpBonus.class, name = "hp-bonus"),
    @JsonSubTypes.Type(value = Effect.RetreatPrevention.class, name = "retreat-prevention"),
    @JsonSubTypes.Type(value = Effect.RetreatCostIncrease.class, name = "retreat-cost-increase"),
    @JsonSubTypes.Type(value = Effect.RetreatCostReduction.class, name = "retreat-cost-reduction"),
    @JsonSubTypes.Type(value = Effect.PreventAttack.class, name = "prevent-attack"),
    @JsonSubTypes.Type(value = Effect.PreventEnergyAttachment.class, name = "prevent-energy-attachment"),
    @JsonSubTypes.Type(value = Effect.PreventPlaying.class, name = "prevent-playing"),
    @JsonSubTypes.Type(value = Effect.EvolutionFlexibility.class, name = "evolution-flexibility"),
    @JsonSubTypes.Type(value = Effect.StatusPrevention.class, name = "status-prevention"),
    @JsonSubTypes.Type(value = Effect.AttackEnergyCostModifier.class, name = "attack-energy-cost-modifier"),
    @JsonSubTypes.Type(value = Effect.DisableWeakness.class, name = "disable-weakness")
})
public sealed interface Effect permits Effect.Hp, Effect.Status, Effect.StatusRecovery, Effect.Draw,
        Effect.Energy, Effect.EnergyTransfer, Effect.Search, Effect.Shuffle, Effect.HandDiscard,
        Effect.Switch, Effect.ToolDiscard, Effect.EndTurn, Effect.CoinFlipManipulation,
        Effect.EvolutionAcceleration, Effect.PullEvolution, Effect.SwapCards, Effect.Modifier {

    /**
     * Effects that register a duration-scoped passive instead of changing state directly.
     */
    sealed interface Modifier extends Effect permits DamageBoost, DamageReduction, PreventDamage, HpBonus,
            RetreatPrevention, RetreatCostIncrease, RetreatCostReduction, PreventAttack,
            PreventEnergyAttachment, PreventPlaying, EvolutionFlexibility, StatusPrevention,
            AttackEnergyCostModifier, DisableWeakness {

        DurationPolicy duration();
    }

    // Immediate effects

    record Hp(
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("target") FieldTarget target,
            @JsonProperty("operation") HpOperation operation) implements Effect {

        public static Hp damage(int amount, FieldTarget target) {
            return new Hp(AmountSpec.of(amount), target, HpOperation.DAMAGE);
        }

        public static Hp heal(int amount, FieldTarget target) {
            return new Hp(AmountSpec.of(amount), target, HpOperation.HEAL);
        }
    }

    /**
     * Applies a special condition. Only the active creature can carry one.
     */
    record Status(
            @JsonProperty("condition") StatusCondition condition,
            @JsonProperty("target") FieldTarget target) implements Effect {
    }

    record StatusRecovery(
            @JsonProperty("target") FieldTarget target,
            @JsonProperty("conditions") List<StatusCondition> conditions) implements Effect {

        public StatusRecovery {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }
    }

    record Draw(@JsonProperty("amount") AmountSpec amount) implements Effect {
    }

    record Energy(
            @JsonProperty("energy_type") EnergyType energyType,
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("target") FieldTarget target,
            @JsonProperty("operation") EnergyOperation operation) implements Effect {
    }

    /**
     * Moves energy between two creatures. The first listed type the source holds is moved;
     * an amount of {@value #ALL} means every unit of it.
     */
    record EnergyTransfer(
            @JsonProperty("source") FieldTarget source,
            @JsonProperty("target") FieldTarget target,
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("energy_types") List<EnergyType> energyTypes) implements Effect {

        public static final int ALL = 999;

        public EnergyTransfer {
            energyTypes = energyTypes == null ? List.of() : List.copyOf(energyTypes);
        }
    }

    record Search(
            @JsonProperty("source") CardTarget source,
            @JsonProperty("amount") AmountSpec amount) implements Effect {
    }

    record Shuffle(
            @JsonProperty("target") PlayerScope target,
            @JsonProperty("shuffle_hand") boolean shuffleHand,
            @JsonProperty("draw_after") AmountSpec drawAfter) implements Effect {
    }

    record HandDiscard(
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("target") PlayerScope target,
            @JsonProperty("shuffle_into_deck") boolean shuffleIntoDeck) implements Effect {
    }

    /**
     * Promotes a bench creature to its owner's active spot.
     */
    record Switch(@JsonProperty("target") FieldTarget target) implements Effect {
    }

    record ToolDiscard(@JsonProperty("target") FieldTarget target) implements Effect {
    }

    record EndTurn() implements Effect {
    }

    record CoinFlipManipulation(@JsonProperty("duration") DurationPolicy duration) implements Effect {
    }

    /**
     * Evolves the target straight into a card from its owner's hand that sits
     * {@code skip_stages + 1} stages above it. Without such a card the effect does nothing.
     */
    record EvolutionAcceleration(
            @JsonProperty("target") FieldTarget target,
            @JsonProperty("skip_stages") int skipStages,
            @JsonProperty("restrictions") List<EvolutionRestriction> restrictions) implements Effect {

        public EvolutionAcceleration {
            restrictions = restrictions == null ? List.of() : List.copyOf(restrictions);
        }
    }

    /**
     * Takes the next stage of the target from its owner's deck, evolves into it and
     * shuffles the deck. {@code evolution_criteria} narrows which cards qualify.
     */
    record PullEvolution(
            @JsonProperty("target") FieldTarget target,
            @JsonProperty("evolution_criteria") CardCriteria evolutionCriteria) implements Effect {
    }

    /**
     * Discards from the start of the hand, then draws. A balanced swap draws as many
     * as were discarded; {@code max_drawn} caps the draw either way.
     */
    record SwapCards(
            @JsonProperty("discard_amount") AmountSpec discardAmount,
            @JsonProperty("draw_amount") AmountSpec drawAmount,
            @JsonProperty("max_drawn") Integer maxDrawn,
            @JsonProperty("balanced") boolean balanced,
            @JsonProperty("target") PlayerScope target) implements Effect {
    }

    // Modifiers

    record DamageBoost(
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("attacker") FieldTargetCriteria attacker,
            @JsonProperty("defender") FieldTargetCriteria defender,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    record DamageReduction(
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("target") FieldTargetCriteria target,
            @JsonProperty("damage_source") FieldTargetCriteria damageSource,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    record PreventDamage(
            @JsonProperty("target") FieldTargetCriteria target,
            @JsonProperty("damage_source") FieldTargetCriteria damageSource,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    record HpBonus(
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("target") FieldTargetCriteria target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    /**
     * Unlike the other modifiers, the target is resolved to concrete creatures when registered.
     */
    record RetreatPrevention(
            @JsonProperty("target") FieldTarget target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    record RetreatCostIncrease(
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("target") FieldTargetCriteria target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    record RetreatCostReduction(
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("target") FieldTargetCriteria target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    record PreventAttack(
            @JsonProperty("target") FieldTargetCriteria target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    record PreventEnergyAttachment(
            @JsonProperty("target") PlayerScope target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    record PreventPlaying(
            @JsonProperty("card_types") List<CardType> cardTypes,
            @JsonProperty("target") PlayerScope target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {

        public PreventPlaying {
            cardTypes = cardTypes == null ? List.of() : List.copyOf(cardTypes);
        }
    }

    /**
     * Lets the creature named {@code target} evolve directly from {@code baseForm},
     * given as a creature name or template id.
     */
    record EvolutionFlexibility(
            @JsonProperty("target") String target,
            @JsonProperty("base_form") String baseForm,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    /**
     * Keeps the listed conditions (all of them if empty) off matching creatures.
     */
    record StatusPrevention(
            @JsonProperty("conditions") List<StatusCondition> conditions,
            @JsonProperty("target") FieldTargetCriteria target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {

        public StatusPrevention {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }
    }

    /**
     * Changes the energy cost of matching creatures' attacks. The amount is signed:
     * positive adds colorless energy, negative takes energy off.
     */
    record AttackEnergyCostModifier(
            @JsonProperty("amount") AmountSpec amount,
            @JsonProperty("target") FieldTargetCriteria target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }

    /**
     * Matching defenders take no weakness bonus.
     */
    record DisableWeakness(
            @JsonProperty("target") FieldTargetCriteria target,
            @JsonProperty("duration") DurationPolicy duration) implements Modifier {
    }
}
