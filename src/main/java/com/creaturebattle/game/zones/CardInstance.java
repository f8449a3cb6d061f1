package com.creaturebattle.game.zones;

import com.creaturebattle.card.CardType;

/**
 * One physical card. The instance id is unique within a game and never changes.
 */
public record CardInstance(String instanceId, String templateId, CardType cardType) {

    @Override
    public String toString() {
        return templateId + "#" + instanceId;
    }
}
