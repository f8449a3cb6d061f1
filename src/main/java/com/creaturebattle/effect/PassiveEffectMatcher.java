package com.creaturebattle.effect;

import com.creaturebattle.card.Card;
import com.creaturebattle.card.CardType;
import com.creaturebattle.card.EnergyRequirement;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.FieldTargetCriteria;
import com.creaturebattle.card.effect.PlayerRef;
import com.creaturebattle.card.effect.PlayerScope;
import com.creaturebattle.card.effect.StatusCondition;
import com.creaturebattle.effect.filter.FieldTargetCriteriaFilter;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.zones.EvolutionEntry;
import com.creaturebattle.game.zones.FieldCard;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers rule questions from the active passive effects.
 * Criteria on a passive are read relative to the passive's owner; a criterion without a
 * player means the owner's own creatures. Matching passives stack additively.
 */
public final class PassiveEffectMatcher {

    private PassiveEffectMatcher() {
    }

    public static int effectiveRetreatCost(GameState state, FieldPosition position) {
        FieldCard card = state.requireFieldCard(position);
        int cost = state.creatureData(card).getRetreatCost();
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.RetreatCostIncrease.class)) {
            Effect.RetreatCostIncrease increase = (Effect.RetreatCostIncrease) passive.modifier();
            if (appliesTo(state, passive, increase.target(), position)) {
                cost += passive.amount();
            }
        }
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.RetreatCostReduction.class)) {
            Effect.RetreatCostReduction reduction = (Effect.RetreatCostReduction) passive.modifier();
            if (appliesTo(state, passive, reduction.target(), position)) {
                cost -= passive.amount();
            }
        }
        return Math.max(0, cost);
    }

    public static boolean isRetreatPrevented(GameState state, FieldPosition position) {
        String instanceId = state.requireFieldCard(position).getFieldInstanceId();
        return state.getPassiveEffects().getByType(Effect.RetreatPrevention.class).stream()
                .anyMatch(p -> p.targetInstanceIds().contains(instanceId));
    }

    public static boolean isAttackPrevented(GameState state, FieldPosition attacker) {
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.PreventAttack.class)) {
            Effect.PreventAttack prevent = (Effect.PreventAttack) passive.modifier();
            if (appliesTo(state, passive, prevent.target(), attacker)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isEnergyAttachmentPrevented(GameState state, int player) {
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.PreventEnergyAttachment.class)) {
            Effect.PreventEnergyAttachment prevent = (Effect.PreventEnergyAttachment) passive.modifier();
            if (scopeOf(prevent.target()).includes(passive.sourcePlayer(), player)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isPlayingPrevented(GameState state, int player, CardType cardType) {
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.PreventPlaying.class)) {
            Effect.PreventPlaying prevent = (Effect.PreventPlaying) passive.modifier();
            if (scopeOf(prevent.target()).includes(passive.sourcePlayer(), player)
                    && prevent.cardTypes().stream().anyMatch(t -> t.accepts(cardType))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extra damage for an attack from {@code attacker} against {@code defender}.
     */
    public static int damageBoost(GameState state, FieldPosition attacker, FieldPosition defender) {
        int boost = 0;
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.DamageBoost.class)) {
            Effect.DamageBoost damageBoost = (Effect.DamageBoost) passive.modifier();
            if (appliesTo(state, passive, damageBoost.attacker(), attacker)
                    && matchesAny(state, passive, damageBoost.defender(), defender)) {
                boost += passive.amount();
            }
        }
        return boost;
    }

    /**
     * Damage subtracted when {@code defender} takes damage from {@code source} (which may be null).
     */
    public static int damageReduction(GameState state, FieldPosition defender, FieldPosition source) {
        int reduction = 0;
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.DamageReduction.class)) {
            Effect.DamageReduction damageReduction = (Effect.DamageReduction) passive.modifier();
            if (appliesTo(state, passive, damageReduction.target(), defender)
                    && sourceMatches(state, passive, damageReduction.damageSource(), source)) {
                reduction += passive.amount();
            }
        }
        return reduction;
    }

    public static boolean isDamagePrevented(GameState state, FieldPosition defender, FieldPosition source) {
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.PreventDamage.class)) {
            Effect.PreventDamage prevent = (Effect.PreventDamage) passive.modifier();
            if (appliesTo(state, passive, prevent.target(), defender)
                    && sourceMatches(state, passive, prevent.damageSource(), source)) {
                return true;
            }
        }
        return false;
    }

    public static int hpBonus(GameState state, FieldPosition position) {
        int bonus = 0;
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.HpBonus.class)) {
            Effect.HpBonus hpBonus = (Effect.HpBonus) passive.modifier();
            if (appliesTo(state, passive, hpBonus.target(), position)) {
                bonus += passive.amount();
            }
        }
        return bonus;
    }

    public static boolean isStatusPrevented(GameState state, FieldPosition position, StatusCondition condition) {
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.StatusPrevention.class)) {
            Effect.StatusPrevention prevention = (Effect.StatusPrevention) passive.modifier();
            if ((prevention.conditions().isEmpty() || prevention.conditions().contains(condition))
                    && appliesTo(state, passive, prevention.target(), position)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isWeaknessDisabled(GameState state, FieldPosition defender) {
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.DisableWeakness.class)) {
            Effect.DisableWeakness disable = (Effect.DisableWeakness) passive.modifier();
            if (appliesTo(state, passive, disable.target(), defender)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The energy an attack from {@code attacker} costs once cost modifiers are summed.
     * An increase is added as colorless energy. A decrease takes colorless energy off
     * first, then typed energy from the last requirement back. The cost never drops
     * below nothing.
     */
    public static List<EnergyRequirement> effectiveAttackCost(GameState state, FieldPosition attacker,
                                                              List<EnergyRequirement> printed) {
        int delta = 0;
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.AttackEnergyCostModifier.class)) {
            Effect.AttackEnergyCostModifier modifier = (Effect.AttackEnergyCostModifier) passive.modifier();
            if (appliesTo(state, passive, modifier.target(), attacker)) {
                delta += passive.amount();
            }
        }
        if (delta == 0) {
            return printed;
        }
        List<EnergyRequirement> cost = new ArrayList<>();
        int colorless = 0;
        for (EnergyRequirement requirement : printed) {
            if (requirement.getType() == null || requirement.getType() == EnergyType.COLORLESS) {
                colorless += requirement.getAmount();
            } else {
                cost.add(new EnergyRequirement(requirement.getType(), requirement.getAmount()));
            }
        }
        colorless += delta;
        for (int i = cost.size() - 1; i >= 0 && colorless < 0; i--) {
            EnergyRequirement typed = cost.get(i);
            int taken = Math.min(typed.getAmount(), -colorless);
            typed.setAmount(typed.getAmount() - taken);
            colorless += taken;
        }
        cost.removeIf(requirement -> requirement.getAmount() <= 0);
        if (colorless > 0) {
            cost.add(new EnergyRequirement(EnergyType.COLORLESS, colorless));
        }
        return cost;
    }

    /**
     * Max HP of the current form plus HP bonuses.
     */
    public static int effectiveHp(GameState state, FieldPosition position) {
        FieldCard card = state.requireFieldCard(position);
        return state.creatureData(card).getMaxHp() + hpBonus(state, position);
    }

    /**
     * Whether an evolution-flexibility passive owned by {@code player} lets {@code evolution}
     * go onto {@code base}, matching the base by the name or template id of its current form.
     */
    public static boolean isEvolutionAllowedByFlexibility(GameState state, int player, Card.Creature evolution,
                                                          FieldCard base) {
        EvolutionEntry current = base.getCurrentForm();
        String baseName = state.getRepository().getCreature(current.templateId()).getName();
        for (PassiveEffect passive : state.getPassiveEffects().getByType(Effect.EvolutionFlexibility.class)) {
            Effect.EvolutionFlexibility flexibility = (Effect.EvolutionFlexibility) passive.modifier();
            if (passive.sourcePlayer() == player
                    && evolution.getName().equals(flexibility.target())
                    && (baseName.equals(flexibility.baseForm()) || current.templateId().equals(flexibility.baseForm()))) {
                return true;
            }
        }
        return false;
    }

    private static boolean appliesTo(GameState state, PassiveEffect passive, FieldTargetCriteria criteria,
                                     FieldPosition position) {
        if (passive.anchorToolInstanceId() != null) {
            // A tool's modifier only covers the creature holding it.
            String holder = state.requireFieldCard(position).getFieldInstanceId();
            if (!holder.equals(passive.anchorInstanceId())) {
                return false;
            }
        }
        FieldTargetCriteria owned = criteria == null
                ? FieldTargetCriteria.of(PlayerRef.SELF, null)
                : criteria.player() == null
                    ? new FieldTargetCriteria(PlayerRef.SELF, criteria.position(), criteria.fieldCriteria())
                    : criteria;
        return FieldTargetCriteriaFilter.matches(state, owned, passive.sourcePlayer(), position);
    }

    private static boolean matchesAny(GameState state, PassiveEffect passive, FieldTargetCriteria criteria,
                                      FieldPosition position) {
        return criteria == null
                || FieldTargetCriteriaFilter.matches(state, criteria, passive.sourcePlayer(), position);
    }

    private static boolean sourceMatches(GameState state, PassiveEffect passive, FieldTargetCriteria criteria,
                                         FieldPosition source) {
        if (criteria == null) {
            return true;
        }
        return source != null && FieldTargetCriteriaFilter.matches(state, criteria, passive.sourcePlayer(), source);
    }

    private static PlayerScope scopeOf(PlayerScope scope) {
        return scope == null ? PlayerScope.SELF : scope;
    }
}
