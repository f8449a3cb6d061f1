package com.creaturebattle.effect;

/**
 * Result of running the effect queue.
 */
public enum DrainStatus {
    IDLE,
    AWAITING_SELECTION
}
