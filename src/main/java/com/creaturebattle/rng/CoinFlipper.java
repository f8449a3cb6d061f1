package com.creaturebattle.rng;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Coin flips for one game.
 * Forced results queued with {@link #queueResults(List)} come first, then a pending
 * guaranteed-heads flip, then the game's {@link GameRng}.
 */
public class CoinFlipper {
    private static final Logger logger = LoggerFactory.getLogger(CoinFlipper.class);

    private final GameRng rng;
    private final Deque<Boolean> queuedResults = new ArrayDeque<>();
    private boolean nextFlipGuaranteedHeads;
    private int flipCount;

    public CoinFlipper(GameRng rng) {
        this.rng = rng;
    }

    /**
     * Flip once. True is heads.
     */
    public boolean flip() {
        flipCount++;
        boolean heads;
        if (!queuedResults.isEmpty()) {
            heads = queuedResults.pollFirst();
        } else if (nextFlipGuaranteedHeads) {
            nextFlipGuaranteedHeads = false;
            heads = true;
        } else {
            heads = rng.flip();
        }
        logger.debug("Coin flip #{}: {}", flipCount, heads ? "heads" : "tails");
        return heads;
    }

    /**
     * Flip {@code count} times and return the number of heads.
     */
    public int flipHeads(int count) {
        int heads = 0;
        for (int i = 0; i < count; i++) {
            if (flip()) {
                heads++;
            }
        }
        return heads;
    }

    public void setNextFlipGuaranteedHeads() {
        nextFlipGuaranteedHeads = true;
    }

    public void clearGuaranteedHeads() {
        nextFlipGuaranteedHeads = false;
    }

    public boolean isNextFlipGuaranteedHeads() {
        return nextFlipGuaranteedHeads;
    }

    /**
     * Force the outcome of the next flips, in order. Used by scripted games and tests.
     */
    public void queueResults(List<Boolean> results) {
        queuedResults.addAll(results);
    }

    public int getFlipCount() {
        return flipCount;
    }
}
