package com.creaturebattle.game.zones;

import com.creaturebattle.game.InvalidReferenceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One player's creatures in play. Index 0 is the active spot, 1..maxBench the bench.
 * The active spot may be empty after a knockout, until a bench creature is promoted.
 */
public class Field {
    private final int maxBenchSize;
    private FieldCard active;
    private final List<FieldCard> bench;

    public Field(int maxBenchSize) {
        this.maxBenchSize = maxBenchSize;
        this.bench = new ArrayList<>();
    }

    public Optional<FieldCard> getActive() {
        return Optional.ofNullable(active);
    }

    public boolean hasActive() {
        return active != null;
    }

    /**
     * Card at a field index, or empty if nothing sits there.
     */
    public Optional<FieldCard> get(int fieldIndex) {
        if (fieldIndex == 0) {
            return getActive();
        }
        if (fieldIndex >= 1 && fieldIndex <= bench.size()) {
            return Optional.of(bench.get(fieldIndex - 1));
        }
        return Optional.empty();
    }

    /**
     * Card at a field index.
     * @throws InvalidReferenceException if nothing sits there
     */
    public FieldCard require(int fieldIndex) {
        return get(fieldIndex).orElseThrow(
                () -> new InvalidReferenceException("No creature at field index " + fieldIndex));
    }

    public List<FieldCard> getBench() {
        return Collections.unmodifiableList(bench);
    }

    public int benchSize() {
        return bench.size();
    }

    public boolean isBenchFull() {
        return bench.size() >= maxBenchSize;
    }

    public int getMaxBenchSize() {
        return maxBenchSize;
    }

    /**
     * Occupied field indices in order: 0 first if there is an active, then the bench.
     */
    public List<Integer> occupiedIndices() {
        List<Integer> indices = new ArrayList<>();
        if (active != null) {
            indices.add(0);
        }
        for (int i = 0; i < bench.size(); i++) {
            indices.add(i + 1);
        }
        return indices;
    }

    /**
     * Every creature in play, active first.
     */
    public List<FieldCard> getAll() {
        List<FieldCard> all = new ArrayList<>();
        if (active != null) {
            all.add(active);
        }
        all.addAll(bench);
        return all;
    }

    public int creatureCount() {
        return bench.size() + (active != null ? 1 : 0);
    }

    public boolean isEmpty() {
        return creatureCount() == 0;
    }

    public int indexOf(String fieldInstanceId) {
        if (active != null && active.getFieldInstanceId().equals(fieldInstanceId)) {
            return 0;
        }
        for (int i = 0; i < bench.size(); i++) {
            if (bench.get(i).getFieldInstanceId().equals(fieldInstanceId)) {
                return i + 1;
            }
        }
        return -1;
    }

    /**
     * Place a creature in the empty active spot.
     */
    public void setActive(FieldCard card) {
        if (active != null) {
            throw new IllegalStateException("Active spot is occupied by " + active);
        }
        active = card;
    }

    public void addToBench(FieldCard card) {
        if (isBenchFull()) {
            throw new IllegalStateException("Bench is full");
        }
        bench.add(card);
    }

    /**
     * Swap the active creature with the bench creature at {@code fieldIndex} (1-based).
     * With an empty active spot the bench creature is simply promoted.
     */
    public void swapWithActive(int fieldIndex) {
        if (fieldIndex < 1 || fieldIndex > bench.size()) {
            throw new InvalidReferenceException("No bench creature at field index " + fieldIndex);
        }
        FieldCard promoted = bench.get(fieldIndex - 1);
        if (active == null) {
            bench.remove(fieldIndex - 1);
        } else {
            bench.set(fieldIndex - 1, active);
        }
        active = promoted;
    }

    /**
     * Take a creature off the field. Removing the active leaves the spot empty; removing
     * a bench creature shifts later bench creatures down.
     */
    public FieldCard remove(int fieldIndex) {
        FieldCard removed = require(fieldIndex);
        if (fieldIndex == 0) {
            active = null;
        } else {
            bench.remove(fieldIndex - 1);
        }
        return removed;
    }
}
