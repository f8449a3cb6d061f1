package com.creaturebattle.effect;

import com.creaturebattle.card.effect.FieldPosition;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Positions chosen for each role of an effect.
 */
public final class ResolvedTargets {
    private final Map<SelectionRole, List<FieldPosition>> byRole;

    private ResolvedTargets(Map<SelectionRole, List<FieldPosition>> byRole) {
        this.byRole = byRole;
    }

    public static ResolvedTargets none() {
        return new ResolvedTargets(new EnumMap<>(SelectionRole.class));
    }

    public static ResolvedTargets of(Map<SelectionRole, List<FieldPosition>> byRole) {
        Map<SelectionRole, List<FieldPosition>> copy = new EnumMap<>(SelectionRole.class);
        byRole.forEach((role, positions) -> copy.put(role, List.copyOf(positions)));
        return new ResolvedTargets(copy);
    }

    public static ResolvedTargets targets(FieldPosition... positions) {
        return of(Map.of(SelectionRole.TARGET, List.of(positions)));
    }

    public List<FieldPosition> get(SelectionRole role) {
        return byRole.getOrDefault(role, List.of());
    }

    public List<FieldPosition> targets() {
        return get(SelectionRole.TARGET);
    }

    public Optional<FieldPosition> firstTarget() {
        return targets().stream().findFirst();
    }

    public Optional<FieldPosition> source() {
        return get(SelectionRole.SOURCE).stream().findFirst();
    }
}
