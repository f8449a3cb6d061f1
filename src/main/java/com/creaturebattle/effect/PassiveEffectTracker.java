package com.creaturebattle.effect;

import com.creaturebattle.card.effect.DurationPolicy;
import com.creaturebattle.card.effect.Effect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores the passive effects active in one game and removes them when their duration ends.
 * Queries against game state live in {@link PassiveEffectMatcher}.
 */
public class PassiveEffectTracker {
    private static final Logger logger = LoggerFactory.getLogger(PassiveEffectTracker.class);

    private final List<PassiveEffect> active = new ArrayList<>();
    private int nextId;

    /**
     * Register a passive. The id on the given effect is replaced.
     * @return the assigned id
     */
    public String register(PassiveEffect effect) {
        String id = "passive-effect-" + nextId++;
        active.add(effect.withId(id));
        logger.debug("Registered {} ({}) from {} until {}", id, effect.modifier().getClass().getSimpleName(),
                effect.effectName(), effect.duration().getJsonValue());
        return id;
    }

    public List<PassiveEffect> getAll() {
        return List.copyOf(active);
    }

    public <T extends Effect.Modifier> List<PassiveEffect> getByType(Class<T> type) {
        return active.stream().filter(p -> type.isInstance(p.modifier())).toList();
    }

    public boolean remove(String id) {
        return active.removeIf(p -> p.id().equals(id));
    }

    /**
     * Drop turn-bound effects that have run out, given the turn now starting.
     * @return how many were removed
     */
    public int expire(int currentTurn) {
        int before = active.size();
        active.removeIf(p -> !p.isLiveAt(currentTurn));
        int removed = before - active.size();
        if (removed > 0) {
            logger.debug("Expired {} passive effect(s) at turn {}", removed, currentTurn);
        }
        return removed;
    }

    /**
     * Drop effects anchored to a creature that left play.
     */
    public int clearForInstance(String fieldInstanceId) {
        int before = active.size();
        active.removeIf(p -> (p.duration() == DurationPolicy.WHILE_IN_PLAY || p.duration() == DurationPolicy.WHILE_ATTACHED)
                && fieldInstanceId.equals(p.anchorInstanceId()));
        return before - active.size();
    }

    /**
     * Drop effects granted by a tool that was detached from a creature.
     */
    public int clearForTool(String toolInstanceId, String fieldInstanceId) {
        int before = active.size();
        active.removeIf(p -> p.duration() == DurationPolicy.WHILE_ATTACHED
                && toolInstanceId.equals(p.anchorToolInstanceId())
                && fieldInstanceId.equals(p.anchorInstanceId()));
        return before - active.size();
    }

    public int size() {
        return active.size();
    }
}
