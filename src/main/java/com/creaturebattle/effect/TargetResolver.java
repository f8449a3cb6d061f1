package com.creaturebattle.effect;

import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.FieldTarget;
import com.creaturebattle.effect.filter.FieldTargetCriteriaFilter;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.zones.FieldCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns field target specifications into concrete field positions.
 */
public final class TargetResolver {
    private static final Logger logger = LoggerFactory.getLogger(TargetResolver.class);

    private TargetResolver() {
    }

    public static TargetResolution resolve(GameState state, FieldTarget target, EffectContext context) {
        return resolve(state, target, context, List.of());
    }

    /**
     * Resolve a target. With a non-empty {@code energyFilter}, only creatures holding at
     * least one energy of those types are considered.
     */
    public static TargetResolution resolve(GameState state, FieldTarget target, EffectContext context,
                                           List<EnergyType> energyFilter) {
        if (target == null) {
            return new TargetResolution.Unsatisfiable("no target given");
        }
        TargetResolution resolution;
        if (target instanceof FieldTarget.Fixed fixed) {
            resolution = resolveFixed(state, fixed, context);
        } else if (target instanceof FieldTarget.Resolved resolved) {
            resolution = resolveExplicit(state, resolved);
        } else if (target instanceof FieldTarget.AllMatching all) {
            resolution = new TargetResolution.Resolved(
                    FieldTargetCriteriaFilter.matching(state, all.criteria(), context.sourcePlayer()));
        } else {
            FieldTarget.SingleChoice choice = (FieldTarget.SingleChoice) target;
            List<FieldPosition> candidates =
                    FieldTargetCriteriaFilter.matching(state, choice.criteria(), context.sourcePlayer());
            resolution = candidates.isEmpty()
                    ? new TargetResolution.Unsatisfiable("no creature matches the choice criteria")
                    : new TargetResolution.RequiresSelection(chooserOf(choice, context), candidates);
        }
        resolution = applyEnergyFilter(state, resolution, energyFilter);
        if (resolution instanceof TargetResolution.RequiresSelection selection
                && selection.candidates().size() == 1) {
            resolution = new TargetResolution.Resolved(selection.candidates());
        }
        logger.debug("{}: {} -> {}", context.effectName(), target, resolution);
        return resolution;
    }

    /**
     * Dry run used by canApply: whether resolving would leave something to act on.
     * An all-matching target with no matches still counts as available.
     */
    public static boolean isAvailable(GameState state, FieldTarget target, EffectContext context,
                                      List<EnergyType> energyFilter) {
        return !(resolve(state, target, context, energyFilter) instanceof TargetResolution.Unsatisfiable);
    }

    /**
     * Position of the creature an effect came from. Trainers count as coming from the
     * acting player's active.
     */
    public static Optional<FieldPosition> sourcePosition(GameState state, EffectContext context) {
        String instanceId = context.sourceInstanceId();
        if (instanceId == null) {
            FieldPosition active = new FieldPosition(context.sourcePlayer(), 0);
            return state.fieldCardAt(active).isPresent() ? Optional.of(active) : Optional.empty();
        }
        return state.locate(instanceId);
    }

    private static TargetResolution resolveFixed(GameState state, FieldTarget.Fixed fixed, EffectContext context) {
        if (fixed.position() == null) {
            return new TargetResolution.Unsatisfiable("fixed target without a position");
        }
        FieldPosition position;
        switch (fixed.position()) {
            case SOURCE -> {
                Optional<FieldPosition> source = sourcePosition(state, context);
                if (source.isEmpty()) {
                    return new TargetResolution.Unsatisfiable("source creature is not in play");
                }
                position = source.get();
            }
            case BENCH -> {
                int player = playerOf(fixed, context);
                int benchIndex = fixed.benchIndex() == null ? 0 : fixed.benchIndex();
                position = new FieldPosition(player, benchIndex + 1);
            }
            default -> position = new FieldPosition(playerOf(fixed, context), 0);
        }
        if (state.fieldCardAt(position).isEmpty()) {
            return new TargetResolution.Unsatisfiable("nothing at " + position);
        }
        return new TargetResolution.Resolved(List.of(position));
    }

    private static TargetResolution resolveExplicit(GameState state, FieldTarget.Resolved resolved) {
        List<FieldPosition> targets = resolved.targets() == null ? List.of() : resolved.targets();
        for (FieldPosition position : targets) {
            if (position.playerId() < 0 || position.playerId() > 1 || state.fieldCardAt(position).isEmpty()) {
                return new TargetResolution.Unsatisfiable("nothing at " + position);
            }
        }
        return new TargetResolution.Resolved(targets);
    }

    private static TargetResolution applyEnergyFilter(GameState state, TargetResolution resolution,
                                                      List<EnergyType> energyFilter) {
        if (energyFilter.isEmpty()) {
            return resolution;
        }
        if (resolution instanceof TargetResolution.Resolved resolved) {
            List<FieldPosition> kept = holdingEnergy(state, resolved.positions(), energyFilter);
            return kept.isEmpty()
                    ? new TargetResolution.Unsatisfiable("no creature holds the required energy")
                    : new TargetResolution.Resolved(kept);
        }
        if (resolution instanceof TargetResolution.RequiresSelection selection) {
            List<FieldPosition> kept = holdingEnergy(state, selection.candidates(), energyFilter);
            return kept.isEmpty()
                    ? new TargetResolution.Unsatisfiable("no creature holds the required energy")
                    : new TargetResolution.RequiresSelection(selection.chooser(), kept);
        }
        return resolution;
    }

    private static List<FieldPosition> holdingEnergy(GameState state, List<FieldPosition> positions,
                                                     List<EnergyType> types) {
        List<FieldPosition> kept = new ArrayList<>();
        for (FieldPosition position : positions) {
            FieldCard card = state.requireFieldCard(position);
            if (types.stream().anyMatch(t -> state.getEnergy().count(card.getFieldInstanceId(), t) > 0)) {
                kept.add(position);
            }
        }
        return kept;
    }

    private static int playerOf(FieldTarget.Fixed fixed, EffectContext context) {
        return fixed.player() == null ? context.sourcePlayer() : fixed.player().resolve(context.sourcePlayer());
    }

    private static int chooserOf(FieldTarget.SingleChoice choice, EffectContext context) {
        return choice.chooser() == null ? context.sourcePlayer() : choice.chooser().resolve(context.sourcePlayer());
    }
}
