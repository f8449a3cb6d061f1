package com.creaturebattle.game.action;

import com.creaturebattle.card.Ability;
import com.creaturebattle.card.Attack;
import com.creaturebattle.card.Card;
import com.creaturebattle.card.CardType;
import com.creaturebattle.card.EnergyRequirement;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.StatusCondition;
import com.creaturebattle.effect.ApplyResult;
import com.creaturebattle.effect.DamageRules;
import com.creaturebattle.effect.DrainStatus;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.EffectHandlerRegistry;
import com.creaturebattle.effect.EffectQueue;
import com.creaturebattle.effect.PassiveEffectMatcher;
import com.creaturebattle.effect.PendingSelection;
import com.creaturebattle.game.AttackDamageCalculator;
import com.creaturebattle.game.EvolutionRules;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.KnockoutProcessor;
import com.creaturebattle.game.PlayerState;
import com.creaturebattle.game.TurnManager;
import com.creaturebattle.game.TurnState;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.game.zones.Field;
import com.creaturebattle.game.zones.FieldCard;
import com.creaturebattle.trigger.GameEvent;
import com.creaturebattle.trigger.TriggerDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Validates and executes player actions.
 *
 * Every action is checked in full before anything is touched, so a rejected action
 * leaves the game exactly as it was. An accepted action runs the effect queue until it
 * is idle or waiting on a selection, then processes knockouts and, if the action ended
 * the turn, the turn transition.
 */
public final class ActionProcessor {
    private static final Logger logger = LoggerFactory.getLogger(ActionProcessor.class);

    private ActionProcessor() {
        // Utility class - prevent instantiation
    }

    /**
     * Process one action from {@code player}.
     *
     * @param state  The current game state
     * @param player The acting player
     * @param action The requested action
     * @return Whether it was accepted, and what the engine is waiting for now
     */
    public static ActionResult process(GameState state, int player, Action action) {
        state.getPlayer(player); // rejects unknown player ids
        Optional<String> rejection = gate(state, player, action);
        if (rejection.isEmpty()) {
            rejection = validate(state, player, action);
        }
        if (rejection.isPresent()) {
            logger.info("Rejected {} from player {}: {}", action, player, rejection.get());
            return ActionResult.rejected(rejection.get(), currentStatus(state),
                    state.getTurnState().getPendingSelection());
        }

        state.incrementExecutedActions();
        String message = execute(state, player, action);
        logger.info("Player {}: {}", player, message);
        DrainStatus status = currentStatus(state);
        return ActionResult.accepted(message, status, state.getTurnState().getPendingSelection());
    }

    // ---- Gating ----

    private static Optional<String> gate(GameState state, int player, Action action) {
        TurnState turnState = state.getTurnState();
        if (state.isGameOver()) {
            return Optional.of("The game is over");
        }
        if (turnState.getPendingSelection().isPresent()) {
            int chooser = turnState.getPendingSelection().get().chooser();
            if (!(action instanceof Action.SelectTarget) || player != chooser) {
                return Optional.of("Waiting for player " + chooser + " to select a target");
            }
            return Optional.empty();
        }
        if (!turnState.getAwaitingActive().isEmpty()) {
            if (!(action instanceof Action.SelectActive) || !turnState.isAwaitingActive(player)) {
                return Optional.of("Waiting for player " + turnState.getAwaitingActive().iterator().next()
                        + " to choose a new active creature");
            }
            return Optional.empty();
        }
        if (action instanceof Action.SelectTarget) {
            return Optional.of("No selection is pending");
        }
        if (action instanceof Action.SelectActive) {
            return Optional.of("No active creature needs replacing");
        }
        if (player != state.getCurrentPlayer()) {
            return Optional.of("It is player " + state.getCurrentPlayer() + "'s turn");
        }
        return Optional.empty();
    }

    // ---- Validation ----

    private static Optional<String> validate(GameState state, int player, Action action) {
        if (action instanceof Action.PlayCard play) {
            return validatePlayCard(state, player, play);
        } else if (action instanceof Action.AttachEnergy attach) {
            return validateAttachEnergy(state, player, attach);
        } else if (action instanceof Action.Attack attack) {
            return validateAttack(state, player, attack);
        } else if (action instanceof Action.Evolve evolve) {
            return validateEvolve(state, player, evolve);
        } else if (action instanceof Action.Retreat retreat) {
            return validateRetreat(state, player, retreat);
        } else if (action instanceof Action.UseAbility ability) {
            return validateUseAbility(state, player, ability);
        } else if (action instanceof Action.SelectTarget select) {
            FieldPosition position = new FieldPosition(select.playerId(), select.fieldIndex());
            PendingSelection pending = state.getTurnState().getPendingSelection().orElseThrow();
            if (!pending.accepts(player, position)) {
                logger.warn("{}: {} is not among the candidates {}",
                        pending.queued().context().effectName(), position, pending.candidates());
                return Optional.of(position + " is not one of the candidates");
            }
            return Optional.empty();
        } else if (action instanceof Action.SelectActive select) {
            Field field = state.getPlayer(player).getField();
            if (field.hasActive()) {
                return Optional.of("Active spot is not empty");
            }
            if (select.benchIndex() < 0 || select.benchIndex() >= field.benchSize()) {
                return Optional.of("No bench creature at bench index " + select.benchIndex());
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    private static Optional<String> validatePlayCard(GameState state, int player, Action.PlayCard play) {
        PlayerState playerState = state.getPlayer(player);
        Optional<CardInstance> inHand = playerState.getHand().get(play.handIndex());
        if (inHand.isEmpty()) {
            return Optional.of("No card at hand index " + play.handIndex());
        }
        Card card = state.getRepository().require(inHand.get().templateId());
        if (card instanceof Card.Creature creature) {
            if (!creature.isBasic()) {
                return Optional.of(creature.getName() + " is not a basic creature; evolve it instead");
            }
            if (!playerState.getField().isEmpty() && playerState.getField().isBenchFull()) {
                return Optional.of("Bench is full");
            }
            return Optional.empty();
        }
        if (PassiveEffectMatcher.isPlayingPrevented(state, player, card.getCardType())) {
            return Optional.of("Playing " + card.getCardType().getJsonValue() + " cards is prevented");
        }
        if (card instanceof Card.Supporter supporter) {
            if (state.getTurnState().isSupporterPlayed()) {
                return Optional.of("A supporter was already played this turn");
            }
            EffectContext context = new EffectContext.Trainer(player, supporter.getName(), CardType.SUPPORTER);
            for (Effect effect : supporter.getEffects()) {
                if (!EffectHandlerRegistry.standard().canApply(state, effect, context)) {
                    return Optional.of(supporter.getName() + " has an effect that cannot be applied");
                }
            }
            return Optional.empty();
        }
        if (card instanceof Card.Item item) {
            EffectContext context = new EffectContext.Trainer(player, item.getName(), CardType.ITEM);
            boolean any = item.getEffects().stream()
                    .anyMatch(effect -> EffectHandlerRegistry.standard().canApply(state, effect, context));
            return any ? Optional.empty() : Optional.of(item.getName() + " would have no effect");
        }
        int target = play.fieldIndex() == null ? 0 : play.fieldIndex();
        Optional<FieldCard> holder = playerState.getField().get(target);
        if (holder.isEmpty()) {
            return Optional.of("No creature at field index " + target + " to hold the tool");
        }
        if (state.getTools().hasTool(holder.get().getFieldInstanceId())) {
            return Optional.of(holder.get().getTemplateId() + " already has a tool attached");
        }
        return Optional.empty();
    }

    private static Optional<String> validateAttachEnergy(GameState state, int player, Action.AttachEnergy attach) {
        if (state.isFirstTurn()) {
            return Optional.of("Energy cannot be attached on the first turn");
        }
        if (state.getEnergy().hasAttachedThisTurn(player)) {
            return Optional.of("Energy was already attached this turn");
        }
        if (state.getEnergy().getCurrentEnergy(player) == null) {
            return Optional.of("No energy is available");
        }
        if (PassiveEffectMatcher.isEnergyAttachmentPrevented(state, player)) {
            return Optional.of("Energy attachment is prevented");
        }
        if (state.getPlayer(player).getField().get(attach.fieldIndex()).isEmpty()) {
            return Optional.of("No creature at field index " + attach.fieldIndex());
        }
        return Optional.empty();
    }

    private static Optional<String> validateAttack(GameState state, int player, Action.Attack attack) {
        if (state.isFirstTurn()) {
            return Optional.of("No attacking on the first turn");
        }
        Optional<FieldCard> active = state.getPlayer(player).getField().getActive();
        if (active.isEmpty()) {
            return Optional.of("No active creature");
        }
        Card.Creature data = state.creatureData(active.get());
        if (attack.attackIndex() < 0 || attack.attackIndex() >= data.getAttacks().size()) {
            return Optional.of(data.getName() + " has no attack " + attack.attackIndex());
        }
        if (!state.getStatuses().canAttack(player)) {
            return Optional.of(data.getName() + " cannot attack while asleep or paralyzed");
        }
        if (PassiveEffectMatcher.isAttackPrevented(state, new FieldPosition(player, 0))) {
            return Optional.of(data.getName() + " is prevented from attacking");
        }
        Attack chosen = data.getAttacks().get(attack.attackIndex());
        List<EnergyRequirement> cost = PassiveEffectMatcher.effectiveAttackCost(state, new FieldPosition(player, 0),
                chosen.getEnergyRequirements());
        if (!state.getEnergy().meetsRequirements(active.get().getFieldInstanceId(), cost)) {
            return Optional.of("Not enough energy for " + chosen.getName());
        }
        if (state.getPlayer(GameState.opponentOf(player)).getField().getActive().isEmpty()) {
            return Optional.of("There is no defending creature");
        }
        return Optional.empty();
    }

    private static Optional<String> validateEvolve(GameState state, int player, Action.Evolve evolve) {
        if (state.getTurn() <= 2) {
            return Optional.of("No evolving during the first two turns");
        }
        PlayerState playerState = state.getPlayer(player);
        Optional<CardInstance> inHand = playerState.getHand().get(evolve.handIndex());
        if (inHand.isEmpty()) {
            return Optional.of("No card at hand index " + evolve.handIndex());
        }
        Card card = state.getRepository().require(inHand.get().templateId());
        if (!(card instanceof Card.Creature evolution) || evolution.isBasic()) {
            return Optional.of(card.getName() + " is not an evolution");
        }
        Optional<FieldCard> base = playerState.getField().get(evolve.fieldIndex());
        if (base.isEmpty()) {
            return Optional.of("No creature at field index " + evolve.fieldIndex());
        }
        FieldCard target = base.get();
        if (!EvolutionRules.canEvolveNow(state, target)) {
            return Optional.of(target.getTemplateId() + " was played or evolved this turn");
        }
        String currentName = state.creatureData(target).getName();
        if (!evolution.getEvolvesFrom().equals(currentName)
                && !PassiveEffectMatcher.isEvolutionAllowedByFlexibility(state, player, evolution, target)) {
            return Optional.of(evolution.getName() + " does not evolve from " + currentName);
        }
        return Optional.empty();
    }

    private static Optional<String> validateRetreat(GameState state, int player, Action.Retreat retreat) {
        if (state.getTurnState().isRetreated()) {
            return Optional.of("Already retreated this turn");
        }
        Field field = state.getPlayer(player).getField();
        Optional<FieldCard> active = field.getActive();
        if (active.isEmpty()) {
            return Optional.of("No active creature");
        }
        if (!state.getStatuses().canRetreat(player)) {
            return Optional.of("Cannot retreat while asleep or paralyzed");
        }
        FieldPosition activePosition = new FieldPosition(player, 0);
        if (PassiveEffectMatcher.isRetreatPrevented(state, activePosition)) {
            return Optional.of("Retreat is prevented");
        }
        if (retreat.benchIndex() < 0 || retreat.benchIndex() >= field.benchSize()) {
            return Optional.of("No bench creature at bench index " + retreat.benchIndex());
        }
        int cost = PassiveEffectMatcher.effectiveRetreatCost(state, activePosition);
        int attached = state.getEnergy().total(active.get().getFieldInstanceId());
        if (attached < cost) {
            return Optional.of("Retreat costs " + cost + " energy but only " + attached + " is attached");
        }
        return Optional.empty();
    }

    private static Optional<String> validateUseAbility(GameState state, int player, Action.UseAbility use) {
        Optional<String> manual = TriggerDispatcher.checkManual(state, player, use.fieldIndex());
        if (manual.isPresent()) {
            return manual;
        }
        FieldCard card = state.getPlayer(player).getField().require(use.fieldIndex());
        Ability ability = state.creatureData(card).getAbility();
        EffectContext context = new EffectContext.Ability(player, ability.getName(), card.getFieldInstanceId());
        boolean any = ability.getEffects().stream()
                .anyMatch(effect -> EffectHandlerRegistry.standard().canApply(state, effect, context));
        return any ? Optional.empty() : Optional.of(ability.getName() + " would have no effect");
    }

    // ---- Execution ----

    private static String execute(GameState state, int player, Action action) {
        if (action instanceof Action.PlayCard play) {
            return playCard(state, player, play);
        } else if (action instanceof Action.AttachEnergy attach) {
            return attachEnergy(state, player, attach);
        } else if (action instanceof Action.Attack attack) {
            return attack(state, player, attack);
        } else if (action instanceof Action.Evolve evolve) {
            return evolve(state, player, evolve);
        } else if (action instanceof Action.Retreat retreat) {
            return retreat(state, player, retreat);
        } else if (action instanceof Action.UseAbility use) {
            TriggerDispatcher.activateManual(state, player, use.fieldIndex());
            drainAndSettle(state);
            return "used the ability at field index " + use.fieldIndex();
        } else if (action instanceof Action.SelectTarget select) {
            FieldPosition position = new FieldPosition(select.playerId(), select.fieldIndex());
            if (EffectQueue.resumeWithSelection(state, player, position) == DrainStatus.IDLE) {
                settle(state);
            }
            return "selected " + position;
        } else if (action instanceof Action.SelectActive select) {
            state.getPlayer(player).getField().swapWithActive(select.benchIndex() + 1);
            state.getTurnState().removeAwaitingActive(player);
            return "promoted " + state.getPlayer(player).getField().getActive().orElseThrow() + " to active";
        }
        state.getTurnState().setShouldEndTurn(true);
        settle(state);
        return "ended the turn";
    }

    private static String playCard(GameState state, int player, Action.PlayCard play) {
        PlayerState playerState = state.getPlayer(player);
        CardInstance instance = playerState.getHand().remove(play.handIndex());
        Card card = state.getRepository().require(instance.templateId());

        if (card instanceof Card.Creature) {
            FieldCard fieldCard = new FieldCard(instance, state.getTurn());
            Field field = playerState.getField();
            if (field.isEmpty()) {
                field.setActive(fieldCard);
            } else {
                field.addToBench(fieldCard);
            }
            TriggerDispatcher.onEvent(state, new GameEvent.Played(player, fieldCard.getFieldInstanceId(), false));
            drainAndSettle(state);
            return "played " + card.getName();
        }
        if (card instanceof Card.Tool tool) {
            FieldCard holder = playerState.getField().require(play.fieldIndex() == null ? 0 : play.fieldIndex());
            state.getTools().attach(holder.getFieldInstanceId(), instance);
            if (!tool.isTriggered()) {
                EffectQueue.enqueue(state, tool.getEffects(), new EffectContext.Tool(
                        player, tool.getName(), holder.getFieldInstanceId(), instance.instanceId()));
            }
            drainAndSettle(state);
            return "attached " + tool.getName() + " to " + holder.getTemplateId();
        }

        playerState.getDiscard().add(instance);
        if (card instanceof Card.Supporter) {
            state.getTurnState().setSupporterPlayed(true);
        }
        EffectQueue.enqueue(state, card.getEffects(),
                new EffectContext.Trainer(player, card.getName(), card.getCardType()));
        drainAndSettle(state);
        return "played " + card.getName();
    }

    private static String attachEnergy(GameState state, int player, Action.AttachEnergy attach) {
        FieldCard target = state.getPlayer(player).getField().require(attach.fieldIndex());
        EnergyType type = state.getEnergy().getCurrentEnergy(player);
        state.getEnergy().attach(target.getFieldInstanceId(), type, 1);
        state.getEnergy().markAttachedThisTurn(player);
        state.getEnergy().setCurrentEnergy(player, null);
        TriggerDispatcher.onEvent(state, new GameEvent.EnergyAttached(player, target.getFieldInstanceId(), type));
        drainAndSettle(state);
        return "attached " + type.getJsonValue() + " energy to " + target.getTemplateId();
    }

    private static String attack(GameState state, int player, Action.Attack attack) {
        FieldPosition attacker = new FieldPosition(player, 0);
        FieldPosition defender = new FieldPosition(GameState.opponentOf(player), 0);
        FieldCard attackerCard = state.requireFieldCard(attacker);
        Attack chosen = state.creatureData(attackerCard).getAttacks().get(attack.attackIndex());
        state.getTurnState().setShouldEndTurn(true);

        if (state.getStatuses().has(player, StatusCondition.CONFUSION) && !state.getCoinFlipper().flip()) {
            ApplyResult selfDamage = DamageRules.applyDamage(state, attacker,
                    state.getConfig().getConfusionSelfDamage());
            dispatch(state, selfDamage.events());
            drainAndSettle(state);
            return chosen.getName() + " failed through confusion; " + selfDamage.amountApplied() + " self-damage";
        }

        EffectContext context = new EffectContext.Attack(player, chosen.getName(), attackerCard.getFieldInstanceId());
        int damage = AttackDamageCalculator.calculate(state, attacker, defender, chosen, context);
        ApplyResult result = DamageRules.applyDamage(state, defender, damage);
        dispatch(state, result.events());
        EffectQueue.enqueue(state, chosen.getEffects(), context);
        drainAndSettle(state);
        return "used " + chosen.getName() + " for " + result.amountApplied() + " damage";
    }

    private static String evolve(GameState state, int player, Action.Evolve evolve) {
        PlayerState playerState = state.getPlayer(player);
        CardInstance instance = playerState.getHand().remove(evolve.handIndex());
        String from = playerState.getField().require(evolve.fieldIndex()).getTemplateId();
        EvolutionRules.evolve(state, new FieldPosition(player, evolve.fieldIndex()), instance);
        drainAndSettle(state);
        return "evolved " + from + " into " + instance.templateId();
    }

    private static String retreat(GameState state, int player, Action.Retreat retreat) {
        Field field = state.getPlayer(player).getField();
        FieldCard retreating = field.getActive().orElseThrow();
        int cost = PassiveEffectMatcher.effectiveRetreatCost(state, new FieldPosition(player, 0));
        state.getEnergy().discardAny(player, retreating.getFieldInstanceId(), cost);
        field.swapWithActive(retreat.benchIndex() + 1);
        state.getStatuses().clear(player);
        state.getTurnState().setRetreated(true);
        TriggerDispatcher.onEvent(state, new GameEvent.Retreated(player, retreating.getFieldInstanceId()));
        drainAndSettle(state);
        return "retreated " + retreating.getTemplateId() + " for " + cost + " energy";
    }

    // ---- Settling ----

    private static void dispatch(GameState state, List<GameEvent> events) {
        for (GameEvent event : events) {
            TriggerDispatcher.onEvent(state, event);
        }
    }

    private static void drainAndSettle(GameState state) {
        if (EffectQueue.drain(state) == DrainStatus.IDLE) {
            settle(state);
        }
    }

    /**
     * Run what follows an idle queue: a paused end of turn, knockouts, then the end of
     * turn if an attack or effect asked for one.
     */
    private static void settle(GameState state) {
        TurnState turnState = state.getTurnState();
        if (state.isGameOver()) {
            return;
        }
        if (turnState.isEndingTurn()) {
            TurnManager.endTurn(state);
            return;
        }
        if (KnockoutProcessor.processKnockouts(state) == DrainStatus.AWAITING_SELECTION) {
            return;
        }
        if (turnState.isShouldEndTurn() && !state.isGameOver()) {
            TurnManager.endTurn(state);
        }
    }

    private static DrainStatus currentStatus(GameState state) {
        return state.getTurnState().getPendingSelection().isPresent()
                ? DrainStatus.AWAITING_SELECTION
                : DrainStatus.IDLE;
    }
}
