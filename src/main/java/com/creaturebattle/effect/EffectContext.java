package com.creaturebattle.effect;

import com.creaturebattle.card.CardType;
import com.creaturebattle.card.TriggerType;

/**
 * Where an effect came from. Target and amount resolution read the source player and,
 * when there is one, the source creature.
 */
public sealed interface EffectContext permits EffectContext.Attack, EffectContext.Ability,
        EffectContext.Trainer, EffectContext.Triggered, EffectContext.Tool {

    int sourcePlayer();

    String effectName();

    /**
     * Field instance id of the source creature, or null when the source is not a creature.
     */
    String sourceInstanceId();

    record Attack(int sourcePlayer, String effectName, String attackerInstanceId) implements EffectContext {
        @Override
        public String sourceInstanceId() {
            return attackerInstanceId;
        }
    }

    record Ability(int sourcePlayer, String effectName, String instanceId) implements EffectContext {
        @Override
        public String sourceInstanceId() {
            return instanceId;
        }
    }

    /**
     * A supporter or item played from hand. Its source position is the player's active.
     */
    record Trainer(int sourcePlayer, String effectName, CardType cardType) implements EffectContext {
        @Override
        public String sourceInstanceId() {
            return null;
        }
    }

    /**
     * A triggered ability or triggered tool on the creature {@code instanceId}.
     */
    record Triggered(int sourcePlayer, String effectName, String instanceId, TriggerType triggerType)
            implements EffectContext {
        @Override
        public String sourceInstanceId() {
            return instanceId;
        }
    }

    /**
     * A tool's passive effects, live while {@code toolInstanceId} stays attached.
     */
    record Tool(int sourcePlayer, String effectName, String creatureInstanceId, String toolInstanceId)
            implements EffectContext {
        @Override
        public String sourceInstanceId() {
            return creatureInstanceId;
        }
    }
}
