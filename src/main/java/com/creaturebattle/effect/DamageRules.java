package com.creaturebattle.effect;

import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.zones.FieldCard;
import com.creaturebattle.trigger.GameEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Puts damage on a creature. Shared by attacks, hp effects and between-turn checkup.
 */
public final class DamageRules {

    private DamageRules() {
    }

    /**
     * Add damage, capped at the creature's remaining HP. Emits Damaged when any damage
     * lands and KnockoutThreatened when no HP is left.
     */
    public static ApplyResult applyDamage(GameState state, FieldPosition target, int amount) {
        FieldCard card = state.requireFieldCard(target);
        int effectiveHp = PassiveEffectMatcher.effectiveHp(state, target);
        int applied = card.addDamage(amount, effectiveHp);
        List<GameEvent> events = new ArrayList<>();
        if (applied > 0) {
            events.add(new GameEvent.Damaged(target.playerId(), card.getFieldInstanceId(), applied));
        }
        if (card.getDamageTaken() >= effectiveHp) {
            events.add(new GameEvent.KnockoutThreatened(target.playerId(), card.getFieldInstanceId()));
        }
        return new ApplyResult(applied, events);
    }

    /**
     * Damage after the defender's reductions and prevention. {@code source} may be null.
     */
    public static int afterDefenses(GameState state, FieldPosition defender, FieldPosition source, int amount) {
        if (PassiveEffectMatcher.isDamagePrevented(state, defender, source)) {
            return 0;
        }
        return Math.max(0, amount - PassiveEffectMatcher.damageReduction(state, defender, source));
    }
}
