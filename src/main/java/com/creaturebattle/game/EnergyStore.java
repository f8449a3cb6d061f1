package com.creaturebattle.game;

import com.creaturebattle.card.EnergyRequirement;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.rng.GameRng;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Energy bookkeeping for both players.
 * Attached energy is keyed by field instance id. Every unit that leaves a creature
 * (discard, retreat, knockout) is recorded in its owner's discarded ledger, so
 * attached + discarded only grows through {@link #attach}.
 */
public class EnergyStore {
    private final Map<String, EnumMap<EnergyType, Integer>> attached = new HashMap<>();
    private final List<EnumMap<EnergyType, Integer>> discarded = new ArrayList<>();
    private final EnergyType[] currentEnergy = new EnergyType[2];
    private final EnergyType[] nextEnergy = new EnergyType[2];
    private final List<List<EnergyType>> availableTypes = new ArrayList<>();
    private final boolean[] attachedThisTurn = new boolean[2];

    public EnergyStore() {
        for (int player = 0; player < 2; player++) {
            discarded.add(new EnumMap<>(EnergyType.class));
            availableTypes.add(Arrays.asList(EnergyType.attachable()));
        }
    }

    // ---- Generation ----

    public void setAvailableTypes(int player, List<EnergyType> types) {
        if (types.isEmpty() || types.stream().anyMatch(t -> !t.isAttachable())) {
            throw new IllegalArgumentException("Available energy types must be non-empty and attachable: " + types);
        }
        availableTypes.set(player, List.copyOf(types));
    }

    public List<EnergyType> getAvailableTypes(int player) {
        return availableTypes.get(player);
    }

    /**
     * Roll the player's energy for a new turn: the previewed next energy becomes current
     * and a new preview is drawn. The first roll draws both.
     */
    public EnergyType generate(int player, GameRng rng) {
        List<EnergyType> types = availableTypes.get(player);
        if (nextEnergy[player] == null || !types.contains(nextEnergy[player])) {
            currentEnergy[player] = rng.pick(types);
        } else {
            currentEnergy[player] = nextEnergy[player];
        }
        nextEnergy[player] = rng.pick(types);
        return currentEnergy[player];
    }

    public EnergyType getCurrentEnergy(int player) {
        return currentEnergy[player];
    }

    public EnergyType getNextEnergy(int player) {
        return nextEnergy[player];
    }

    public void setCurrentEnergy(int player, EnergyType type) {
        currentEnergy[player] = type;
    }

    public boolean hasAttachedThisTurn(int player) {
        return attachedThisTurn[player];
    }

    public void markAttachedThisTurn(int player) {
        attachedThisTurn[player] = true;
    }

    public void resetTurnFlags(int player) {
        attachedThisTurn[player] = false;
    }

    // ---- Attached energy ----

    public void attach(String fieldInstanceId, EnergyType type, int amount) {
        if (!type.isAttachable()) {
            throw new IllegalArgumentException("Cannot attach " + type.getJsonValue() + " energy");
        }
        if (amount <= 0) {
            return;
        }
        attached.computeIfAbsent(fieldInstanceId, k -> new EnumMap<>(EnergyType.class))
                .merge(type, amount, Integer::sum);
    }

    public int count(String fieldInstanceId, EnergyType type) {
        EnumMap<EnergyType, Integer> energy = attached.get(fieldInstanceId);
        return energy == null ? 0 : energy.getOrDefault(type, 0);
    }

    public int total(String fieldInstanceId) {
        EnumMap<EnergyType, Integer> energy = attached.get(fieldInstanceId);
        if (energy == null) {
            return 0;
        }
        return energy.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<EnergyType, Integer> getAttached(String fieldInstanceId) {
        EnumMap<EnergyType, Integer> energy = attached.get(fieldInstanceId);
        return energy == null ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(energy));
    }

    /**
     * Remove up to {@code amount} units of one type into the owner's discarded ledger.
     * @return the number of units actually discarded
     */
    public int discard(int owner, String fieldInstanceId, EnergyType type, int amount) {
        int removed = take(fieldInstanceId, type, amount);
        if (removed > 0) {
            discarded.get(owner).merge(type, removed, Integer::sum);
        }
        return removed;
    }

    /**
     * Discard {@code amount} units of any type, taking types in declaration order.
     * @return the number of units actually discarded
     */
    public int discardAny(int owner, String fieldInstanceId, int amount) {
        int remaining = amount;
        for (EnergyType type : EnergyType.attachable()) {
            if (remaining <= 0) {
                break;
            }
            remaining -= discard(owner, fieldInstanceId, type, remaining);
        }
        return amount - remaining;
    }

    /**
     * Discard every unit attached to a creature. Used when it leaves play.
     */
    public int discardAll(int owner, String fieldInstanceId) {
        EnumMap<EnergyType, Integer> energy = attached.remove(fieldInstanceId);
        if (energy == null) {
            return 0;
        }
        int total = 0;
        for (Map.Entry<EnergyType, Integer> entry : energy.entrySet()) {
            discarded.get(owner).merge(entry.getKey(), entry.getValue(), Integer::sum);
            total += entry.getValue();
        }
        return total;
    }

    /**
     * Move up to {@code amount} units of one type between creatures.
     * @return the number of units actually moved
     */
    public int transfer(String fromInstanceId, String toInstanceId, EnergyType type, int amount) {
        int moved = take(fromInstanceId, type, amount);
        if (moved > 0) {
            attach(toInstanceId, type, moved);
        }
        return moved;
    }

    private int take(String fieldInstanceId, EnergyType type, int amount) {
        EnumMap<EnergyType, Integer> energy = attached.get(fieldInstanceId);
        if (energy == null || amount <= 0) {
            return 0;
        }
        int present = energy.getOrDefault(type, 0);
        int removed = Math.min(present, amount);
        if (present - removed == 0) {
            energy.remove(type);
        } else {
            energy.put(type, present - removed);
        }
        if (energy.isEmpty()) {
            attached.remove(fieldInstanceId);
        }
        return removed;
    }

    /**
     * Whether the creature's energy pays for an attack. Typed requirements are paid
     * first; colorless requirements take whatever is left.
     */
    public boolean meetsRequirements(String fieldInstanceId, List<EnergyRequirement> requirements) {
        int typedTotal = 0;
        int colorless = 0;
        EnumMap<EnergyType, Integer> needed = new EnumMap<>(EnergyType.class);
        for (EnergyRequirement requirement : requirements) {
            if (requirement.getType() == null || requirement.getType() == EnergyType.COLORLESS) {
                colorless += requirement.getAmount();
            } else {
                needed.merge(requirement.getType(), requirement.getAmount(), Integer::sum);
                typedTotal += requirement.getAmount();
            }
        }
        for (Map.Entry<EnergyType, Integer> entry : needed.entrySet()) {
            if (count(fieldInstanceId, entry.getKey()) < entry.getValue()) {
                return false;
            }
        }
        return total(fieldInstanceId) >= typedTotal + colorless;
    }

    // ---- Discarded ledger ----

    public Map<EnergyType, Integer> getDiscarded(int player) {
        return Collections.unmodifiableMap(new EnumMap<>(discarded.get(player)));
    }

    public int totalDiscarded(int player) {
        return discarded.get(player).values().stream().mapToInt(Integer::intValue).sum();
    }
}
