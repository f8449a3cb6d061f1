package com.creaturebattle.game.zones;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Hand - cards in hand, in the order they arrived.
 */
public class Hand {
    private final List<CardInstance> cards;

    public Hand() {
        this.cards = new ArrayList<>();
    }

    public void add(CardInstance card) {
        cards.add(card);
    }

    public void addAll(List<CardInstance> cardsToAdd) {
        cards.addAll(cardsToAdd);
    }

    /**
     * Get the card at an index without removing it.
     */
    public Optional<CardInstance> get(int index) {
        if (index >= 0 && index < cards.size()) {
            return Optional.of(cards.get(index));
        }
        return Optional.empty();
    }

    /**
     * Remove a card by index.
     * @param index The index of the card to remove
     * @return The removed card, or null if index is out of bounds
     */
    public CardInstance remove(int index) {
        if (index >= 0 && index < cards.size()) {
            return cards.remove(index);
        }
        return null;
    }

    /**
     * Remove up to {@code count} cards, taking from the end of the hand first.
     */
    public List<CardInstance> removeFromEnd(int count) {
        List<CardInstance> removed = new ArrayList<>();
        for (int i = 0; i < count && !cards.isEmpty(); i++) {
            removed.add(cards.remove(cards.size() - 1));
        }
        return removed;
    }

    /**
     * Remove up to {@code count} cards from the start of the hand.
     */
    public List<CardInstance> removeFromStart(int count) {
        List<CardInstance> removed = new ArrayList<>();
        for (int i = 0; i < count && !cards.isEmpty(); i++) {
            removed.add(cards.remove(0));
        }
        return removed;
    }

    /**
     * Remove and return every card.
     */
    public List<CardInstance> removeAll() {
        List<CardInstance> removed = new ArrayList<>(cards);
        cards.clear();
        return removed;
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<CardInstance> getCards() {
        return List.copyOf(cards);
    }
}
