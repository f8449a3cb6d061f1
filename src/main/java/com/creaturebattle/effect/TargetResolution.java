package com.creaturebattle.effect;

import com.creaturebattle.card.effect.FieldPosition;

import java.util.List;

/**
 * Outcome of resolving a field target.
 */
public sealed interface TargetResolution permits TargetResolution.Resolved,
        TargetResolution.RequiresSelection, TargetResolution.Unsatisfiable {

    /**
     * Concrete positions. May be empty for all-matching targets.
     */
    record Resolved(List<FieldPosition> positions) implements TargetResolution {
        public Resolved {
            positions = List.copyOf(positions);
        }
    }

    /**
     * More than one candidate; {@code chooser} (an absolute player id) must pick one.
     */
    record RequiresSelection(int chooser, List<FieldPosition> candidates) implements TargetResolution {
        public RequiresSelection {
            candidates = List.copyOf(candidates);
        }
    }

    record Unsatisfiable(String reason) implements TargetResolution {
    }
}
