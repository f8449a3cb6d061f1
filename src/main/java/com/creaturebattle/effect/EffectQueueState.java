package com.creaturebattle.effect;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * FIFO of effects waiting to resolve. Lives in the game state so a suspended game can
 * be resumed later.
 */
public class EffectQueueState {
    private final Deque<QueuedEffect> pending = new ArrayDeque<>();

    public void push(QueuedEffect effect) {
        pending.addLast(effect);
    }

    public Optional<QueuedEffect> pop() {
        return Optional.ofNullable(pending.pollFirst());
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }

    public List<QueuedEffect> snapshot() {
        return List.copyOf(pending);
    }

    public void clear() {
        pending.clear();
    }
}
