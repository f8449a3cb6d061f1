package com.creaturebattle.effect.filter;

import com.creaturebattle.card.Card;
import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.effect.CardCriteria;
import com.creaturebattle.game.zones.CardInstance;

/**
 * Matches cards in hand, deck or discard against {@link CardCriteria}.
 */
public final class CardCriteriaFilter {

    private CardCriteriaFilter() {
    }

    public static boolean matches(CardRepository repository, CardCriteria criteria, CardInstance card) {
        if (criteria == null) {
            return true;
        }
        if (criteria.cardType() != null && !criteria.cardType().accepts(card.cardType())) {
            return false;
        }
        Card data = repository.require(card.templateId());
        if (criteria.names() != null && !criteria.names().isEmpty() && !criteria.names().contains(data.getName())) {
            return false;
        }
        if (criteria.creature() != null) {
            return data instanceof Card.Creature creature
                    && CreatureCriteriaFilter.matches(criteria.creature(), creature);
        }
        return true;
    }
}
