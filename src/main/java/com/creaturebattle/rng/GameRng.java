package com.creaturebattle.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * The single random source of a game: deck shuffles, energy generation and coin flips
 * all draw from it, so a game replays identically from its seed and its actions.
 * The generator is Mulberry32 over a 32-bit state.
 */
public final class GameRng {
    private static final int INCREMENT = 0x6D2B79F5;
    private static final double TWO_POW_32 = 4294967296.0;

    private final long seed;
    private int counter;
    private long draws;

    /**
     * Only the lower 32 bits of {@code seed} are used.
     */
    public GameRng(long seed) {
        this.seed = seed & 0xFFFFFFFFL;
        this.counter = (int) this.seed;
    }

    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * A value in [0, 1).
     */
    public double next() {
        return Integer.toUnsignedLong(nextBits()) / TWO_POW_32;
    }

    /**
     * A value in [0, bound).
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) (next() * bound);
    }

    /**
     * True is heads.
     */
    public boolean flip() {
        return next() < 0.5;
    }

    public <T> T pick(List<T> options) {
        if (options.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return options.get(nextInt(options.size()));
    }

    /**
     * Shuffles in place, walking from the end and swapping each slot with one at or before it.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            Collections.swap(list, i, nextInt(i + 1));
        }
    }

    public long getSeed() {
        return seed;
    }

    /**
     * How many values this generator has produced.
     */
    public long getDraws() {
        return draws;
    }

    private int nextBits() {
        draws++;
        counter += INCREMENT;
        int t = counter;
        t = (t ^ (t >>> 15)) * (t | 1);
        t ^= t + (t ^ (t >>> 7)) * (t | 61);
        return t ^ (t >>> 14);
    }
}
