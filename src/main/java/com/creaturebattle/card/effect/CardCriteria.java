package com.creaturebattle.card.effect;

import com.creaturebattle.card.CardType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Criteria on a card in hand, deck or discard. Creature criteria only match creature cards.
 */
public record CardCriteria(
        @JsonProperty("card_type") CardType cardType,
        @JsonProperty("names") List<String> names,
        @JsonProperty("creature") CreatureCriteria creature) {
}
