package com.creaturebattle.game.zones;

import com.creaturebattle.card.CardType;

import java.util.ArrayList;
import java.util.List;

/**
 * Discard pile (ordered stack). Most recent cards are at the end.
 */
public class DiscardPile {
    private final List<CardInstance> cards;

    public DiscardPile() {
        this.cards = new ArrayList<>();
    }

    public void add(CardInstance card) {
        cards.add(card);
    }

    public void addAll(List<CardInstance> cardsToAdd) {
        cards.addAll(cardsToAdd);
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<CardInstance> getCards() {
        return List.copyOf(cards);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public int count(CardType type) {
        return (int) cards.stream()
                .filter(c -> c.cardType() == type)
                .count();
    }
}
