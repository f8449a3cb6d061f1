package com.creaturebattle.game;

import com.creaturebattle.card.Attack;
import com.creaturebattle.card.Card;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.PassiveEffectMatcher;
import com.creaturebattle.effect.ValueResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Works out how much damage an attack deals to the defending active creature.
 */
public final class AttackDamageCalculator {
    private static final Logger logger = LoggerFactory.getLogger(AttackDamageCalculator.class);

    private AttackDamageCalculator() {
        // Utility class - prevent instantiation
    }

    /**
     * Damage for an attack: base amount, plus the weakness bonus when the defender is weak
     * to the attacker's type, the base is above zero and weakness is not disabled, plus damage boosts, minus the
     * defender's reductions (never below zero). Prevention makes it zero.
     *
     * @param state    The current game state
     * @param attacker Position of the attacking creature
     * @param defender Position of the defending creature
     * @param attack   The attack being used
     * @param context  Attack context, used to resolve a variable base amount
     * @return Damage to put on the defender
     */
    public static int calculate(GameState state, FieldPosition attacker, FieldPosition defender,
                                Attack attack, EffectContext context) {
        int base = ValueResolver.resolve(state, attack.getDamage(), context);
        int damage = base;

        Card.Creature attackerData = state.creatureData(state.requireFieldCard(attacker));
        Card.Creature defenderData = state.creatureData(state.requireFieldCard(defender));
        if (base > 0 && defenderData.getWeakness() != null && defenderData.getWeakness() == attackerData.getType()
                && !PassiveEffectMatcher.isWeaknessDisabled(state, defender)) {
            damage += state.getConfig().getWeaknessBonus();
        }
        damage += PassiveEffectMatcher.damageBoost(state, attacker, defender);
        damage = Math.max(0, damage - PassiveEffectMatcher.damageReduction(state, defender, attacker));
        if (PassiveEffectMatcher.isDamagePrevented(state, defender, attacker)) {
            damage = 0;
        }
        logger.debug("{}: base {} -> {} against {}", attack.getName(), base, damage, defender);
        return damage;
    }
}
