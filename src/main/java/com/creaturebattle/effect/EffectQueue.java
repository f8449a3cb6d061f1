package com.creaturebattle.effect;

import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.game.GameState;
import com.creaturebattle.trigger.GameEvent;
import com.creaturebattle.trigger.TriggerDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves queued effects in FIFO order. Events raised while applying an effect fire
 * triggers, which append to the same queue, so a whole cascade settles in one drain.
 * An effect that needs a player's choice suspends the queue until
 * {@link #resumeWithSelection} supplies it.
 */
public final class EffectQueue {
    private static final Logger logger = LoggerFactory.getLogger(EffectQueue.class);

    private EffectQueue() {
    }

    public static void enqueue(GameState state, List<Effect> effects, EffectContext context) {
        for (Effect effect : effects) {
            state.getEffectQueue().push(new QueuedEffect(effect, context));
        }
    }

    /**
     * Resolve queued effects until the queue is empty or a selection is needed.
     *
     * @throws IllegalStateException if more effects resolve than the configured step limit allows
     */
    public static DrainStatus drain(GameState state) {
        if (state.getTurnState().getPendingSelection().isPresent()) {
            return DrainStatus.AWAITING_SELECTION;
        }
        EffectQueueState queue = state.getEffectQueue();
        int maxSteps = state.getConfig().getMaxDrainSteps();
        int steps = 0;
        while (!queue.isEmpty()) {
            if (state.isGameOver()) {
                logger.debug("Game over, dropping {} queued effects", queue.size());
                queue.clear();
                return DrainStatus.IDLE;
            }
            if (++steps > maxSteps) {
                throw new IllegalStateException("Effect queue exceeded " + maxSteps
                        + " steps in one drain; a trigger is probably re-firing itself");
            }
            QueuedEffect next = queue.pop().orElseThrow();
            if (!resolveAndApply(state, next, new EnumMap<>(SelectionRole.class))) {
                return DrainStatus.AWAITING_SELECTION;
            }
        }
        return DrainStatus.IDLE;
    }

    /**
     * Supply the pending choice and continue draining. A selection from the wrong
     * player, or of a position that is not a candidate, is ignored.
     */
    public static DrainStatus resumeWithSelection(GameState state, int player, FieldPosition position) {
        Optional<PendingSelection> pending = state.getTurnState().getPendingSelection();
        if (pending.isEmpty()) {
            logger.warn("Ignoring selection {} from player {}: nothing is pending", position, player);
            return DrainStatus.IDLE;
        }
        PendingSelection selection = pending.get();
        if (!selection.accepts(player, position)) {
            logger.warn("Ignoring selection {} from player {}: expected player {} to pick one of {}",
                    position, player, selection.chooser(), selection.candidates());
            return DrainStatus.AWAITING_SELECTION;
        }
        state.getTurnState().clearPendingSelection();
        Map<SelectionRole, List<FieldPosition>> choices = new EnumMap<>(SelectionRole.class);
        choices.putAll(selection.choices());
        choices.put(selection.role(), List.of(position));
        logger.debug("{}: player {} selected {}", selection.queued().context().effectName(), player, position);
        if (!resolveAndApply(state, selection.queued(), choices)) {
            return DrainStatus.AWAITING_SELECTION;
        }
        return drain(state);
    }

    /**
     * @return false if the effect suspended waiting for a selection
     */
    private static boolean resolveAndApply(GameState state, QueuedEffect queued,
                                           Map<SelectionRole, List<FieldPosition>> choices) {
        EffectHandlerRegistry registry = EffectHandlerRegistry.standard();
        Effect effect = queued.effect();
        EffectContext context = queued.context();

        for (ResolutionRequirement requirement : registry.getResolutionRequirements(effect)) {
            if (choices.containsKey(requirement.role())) {
                continue;
            }
            TargetResolution resolution =
                    TargetResolver.resolve(state, requirement.target(), context, requirement.energyFilter());
            if (resolution instanceof TargetResolution.Resolved resolved) {
                choices.put(requirement.role(), resolved.positions());
            } else if (resolution instanceof TargetResolution.RequiresSelection selection) {
                state.getTurnState().setPendingSelection(new PendingSelection(
                        queued, requirement.role(), selection.chooser(), selection.candidates(), choices));
                logger.debug("{}: waiting for player {} to choose a {} from {}", context.effectName(),
                        selection.chooser(), requirement.role(), selection.candidates());
                return false;
            } else {
                TargetResolution.Unsatisfiable unsatisfiable = (TargetResolution.Unsatisfiable) resolution;
                logger.warn("{}: skipping {}, {}", context.effectName(),
                        effect.getClass().getSimpleName(), unsatisfiable.reason());
                return true;
            }
        }

        ApplyResult result = registry.apply(state, effect, context, ResolvedTargets.of(choices));
        logger.debug("{}: applied {} ({})", context.effectName(), effect.getClass().getSimpleName(),
                result.amountApplied());
        for (GameEvent event : result.events()) {
            TriggerDispatcher.onEvent(state, event);
        }
        return true;
    }
}
