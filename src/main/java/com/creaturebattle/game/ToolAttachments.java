package com.creaturebattle.game;

import com.creaturebattle.game.zones.CardInstance;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tools attached to creatures, keyed by field instance id. At most one tool per creature.
 */
public class ToolAttachments {
    private final Map<String, CardInstance> tools = new HashMap<>();

    public Optional<CardInstance> get(String fieldInstanceId) {
        return Optional.ofNullable(tools.get(fieldInstanceId));
    }

    public boolean hasTool(String fieldInstanceId) {
        return tools.containsKey(fieldInstanceId);
    }

    public void attach(String fieldInstanceId, CardInstance tool) {
        if (tools.containsKey(fieldInstanceId)) {
            throw new IllegalStateException("Creature " + fieldInstanceId + " already holds " + tools.get(fieldInstanceId));
        }
        tools.put(fieldInstanceId, tool);
    }

    /**
     * @return the detached tool, or empty if there was none
     */
    public Optional<CardInstance> detach(String fieldInstanceId) {
        return Optional.ofNullable(tools.remove(fieldInstanceId));
    }
}
