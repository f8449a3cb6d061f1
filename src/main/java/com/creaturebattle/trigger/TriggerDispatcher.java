package com.creaturebattle.trigger;

import com.creaturebattle.card.Ability;
import com.creaturebattle.card.Card;
import com.creaturebattle.card.Trigger;
import com.creaturebattle.card.TriggerType;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.EffectQueue;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.InvalidReferenceException;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.game.zones.FieldCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fires creature abilities and attached tools in response to game events.
 * Fired effects are appended to the effect queue; nothing resolves here.
 */
public final class TriggerDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(TriggerDispatcher.class);

    private TriggerDispatcher() {
        // Utility class - prevent instantiation
    }

    /**
     * Enqueue the effects of every trigger the event fires.
     *
     * Turn events reach every creature on the field, current player first, each side in
     * position order. Other events reach only the creature they name. For each creature
     * the ability fires before its tool.
     *
     * @param state The current game state
     * @param event The event that happened
     */
    public static void onEvent(GameState state, GameEvent event) {
        if (event instanceof GameEvent.EndOfTurn) {
            fireAll(state, TriggerType.END_OF_TURN);
        } else if (event instanceof GameEvent.StartOfTurn) {
            fireAll(state, TriggerType.START_OF_TURN);
        } else if (event instanceof GameEvent.Checkup) {
            fireAll(state, TriggerType.ON_CHECKUP);
        } else if (event instanceof GameEvent.Damaged damaged) {
            fireOne(state, damaged.instanceId(), TriggerType.DAMAGED, trigger -> true);
        } else if (event instanceof GameEvent.EnergyAttached attached) {
            fireOne(state, attached.instanceId(), TriggerType.ENERGY_ATTACHMENT,
                    trigger -> trigger.getEnergyType() == null || trigger.getEnergyType() == attached.energyType());
        } else if (event instanceof GameEvent.Played played) {
            fireOne(state, played.instanceId(), TriggerType.ON_PLAY,
                    trigger -> !(played.viaEvolution() && trigger.isFilterEvolution()));
        } else if (event instanceof GameEvent.BeforeKnockout knockout) {
            fireOne(state, knockout.instanceId(), TriggerType.BEFORE_KNOCKOUT, trigger -> true);
        } else if (event instanceof GameEvent.Retreated retreated) {
            fireOne(state, retreated.instanceId(), TriggerType.ON_RETREAT, trigger -> true);
        }
        // KnockoutThreatened is picked up by knockout processing, not by triggers
    }

    /**
     * Whether the creature's ability can be activated by hand right now.
     *
     * @param state      The current game state
     * @param player     The acting player
     * @param fieldIndex Position of the creature on the player's field
     * @return Empty if usable, otherwise the reason it is not
     */
    public static Optional<String> checkManual(GameState state, int player, int fieldIndex) {
        Optional<FieldCard> fieldCard = state.getPlayer(player).getField().get(fieldIndex);
        if (fieldCard.isEmpty()) {
            return Optional.of("No creature at position " + fieldIndex);
        }
        FieldCard card = fieldCard.get();
        Ability ability = state.creatureData(card).getAbility();
        if (ability == null || ability.getTrigger() == null
                || ability.getTrigger().getType() != TriggerType.MANUAL) {
            return Optional.of(card.getTemplateId() + " has no manual ability");
        }
        if (!ability.getTrigger().isUnlimited()
                && state.getTurnState().hasUsedAbility(card.getFieldInstanceId(), ability.getName())) {
            return Optional.of(ability.getName() + " was already used this turn");
        }
        return Optional.empty();
    }

    /**
     * Enqueue a manual ability's effects and mark it used for the turn.
     *
     * @throws InvalidReferenceException if the position holds no creature with a manual ability
     */
    public static void activateManual(GameState state, int player, int fieldIndex) {
        FieldCard card = state.getPlayer(player).getField().require(fieldIndex);
        Ability ability = state.creatureData(card).getAbility();
        if (ability == null || ability.getTrigger() == null
                || ability.getTrigger().getType() != TriggerType.MANUAL) {
            throw new InvalidReferenceException(card.getTemplateId() + " has no manual ability");
        }
        state.getTurnState().markAbilityUsed(card.getFieldInstanceId(), ability.getName());
        logger.debug("Player {} activates {} on {}", player, ability.getName(), card);
        EffectQueue.enqueue(state, ability.getEffects(),
                new EffectContext.Ability(player, ability.getName(), card.getFieldInstanceId()));
    }

    private static void fireAll(GameState state, TriggerType type) {
        List<FieldPosition> order = new ArrayList<>();
        int current = state.getCurrentPlayer();
        for (int player : new int[]{current, GameState.opponentOf(current)}) {
            for (int index : state.getPlayer(player).getField().occupiedIndices()) {
                order.add(new FieldPosition(player, index));
            }
        }
        for (FieldPosition position : order) {
            state.fieldCardAt(position).ifPresent(card -> fire(state, position.playerId(), card, type, trigger -> true));
        }
    }

    private static void fireOne(GameState state, String instanceId, TriggerType type, TriggerFilter filter) {
        Optional<FieldPosition> position = state.locate(instanceId);
        if (position.isEmpty()) {
            logger.debug("{} trigger for {} skipped, creature has left the field", type, instanceId);
            return;
        }
        FieldCard card = state.requireFieldCard(position.get());
        fire(state, position.get().playerId(), card, type, filter);
    }

    private static void fire(GameState state, int owner, FieldCard card, TriggerType type, TriggerFilter filter) {
        Ability ability = state.creatureData(card).getAbility();
        if (ability != null && matches(state, owner, ability.getTrigger(), type, filter)) {
            logger.debug("{} fires {} on {}", type, ability.getName(), card);
            EffectQueue.enqueue(state, ability.getEffects(),
                    new EffectContext.Triggered(owner, ability.getName(), card.getFieldInstanceId(), type));
        }

        Optional<CardInstance> tool = state.getTools().get(card.getFieldInstanceId());
        if (tool.isPresent()) {
            Card.Tool toolCard = state.getRepository().getTool(tool.get().templateId());
            if (toolCard.isTriggered() && matches(state, owner, toolCard.getTrigger(), type, filter)) {
                logger.debug("{} fires tool {} on {}", type, toolCard.getName(), card);
                EffectQueue.enqueue(state, toolCard.getEffects(),
                        new EffectContext.Triggered(owner, toolCard.getName(), card.getFieldInstanceId(), type));
            }
        }
    }

    private static boolean matches(GameState state, int owner, Trigger trigger, TriggerType type,
                                   TriggerFilter filter) {
        if (trigger == null || trigger.getType() != type) {
            return false;
        }
        if (trigger.isOwnTurnOnly() && owner != state.getCurrentPlayer()) {
            return false;
        }
        if (trigger.isFirstTurnOnly() && !state.isFirstTurn()) {
            return false;
        }
        return filter.accepts(trigger);
    }

    @FunctionalInterface
    private interface TriggerFilter {
        boolean accepts(Trigger trigger);
    }
}
