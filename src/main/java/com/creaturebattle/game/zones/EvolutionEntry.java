package com.creaturebattle.game.zones;

/**
 * One creature card inside a field card's evolution stack.
 */
public record EvolutionEntry(String instanceId, String templateId) {

    public static EvolutionEntry of(CardInstance card) {
        return new EvolutionEntry(card.instanceId(), card.templateId());
    }
}
