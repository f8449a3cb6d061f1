package com.creaturebattle.effect;

import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.FieldTarget;

import java.util.List;

/**
 * A field target an effect needs resolved before it can apply.
 *
 * @param role         which part of the effect it fills
 * @param target       the target specification
 * @param energyFilter if non-empty, candidates must hold at least one energy of these types
 */
public record ResolutionRequirement(SelectionRole role, FieldTarget target, List<EnergyType> energyFilter) {

    public ResolutionRequirement {
        energyFilter = energyFilter == null ? List.of() : List.copyOf(energyFilter);
    }

    public static ResolutionRequirement target(FieldTarget target) {
        return new ResolutionRequirement(SelectionRole.TARGET, target, List.of());
    }
}
