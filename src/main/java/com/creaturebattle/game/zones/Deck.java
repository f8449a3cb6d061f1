package com.creaturebattle.game.zones;

import com.creaturebattle.rng.GameRng;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Deck - ordered stack of cards. Top of the deck is at index 0.
 */
public class Deck {
    private Deque<CardInstance> cards;

    public Deck() {
        this.cards = new ArrayDeque<>();
    }

    public Deck(List<CardInstance> initial) {
        this.cards = new ArrayDeque<>(initial);
    }

    /**
     * Put a card on the bottom of the deck.
     */
    public void addToBottom(CardInstance card) {
        cards.addLast(card);
    }

    public void addAllToBottom(List<CardInstance> toAdd) {
        for (CardInstance card : toAdd) {
            cards.addLast(card);
        }
    }

    public Optional<CardInstance> peekTop() {
        return Optional.ofNullable(cards.peekFirst());
    }

    /**
     * Draw from the top.
     * @return the drawn card, or empty if the deck is empty
     */
    public Optional<CardInstance> draw() {
        return Optional.ofNullable(cards.pollFirst());
    }

    /**
     * Draw up to {@code n} cards from the top.
     * @return List of drawn cards (may be fewer if the deck runs out)
     */
    public List<CardInstance> drawN(int n) {
        List<CardInstance> drawn = new ArrayList<>();
        for (int i = 0; i < n && !cards.isEmpty(); i++) {
            drawn.add(cards.removeFirst());
        }
        return drawn;
    }

    /**
     * Remove the first {@code limit} cards, from the top down, that match.
     */
    public List<CardInstance> removeMatching(Predicate<CardInstance> matcher, int limit) {
        List<CardInstance> removed = new ArrayList<>();
        Iterator<CardInstance> iter = cards.iterator();
        while (iter.hasNext() && removed.size() < limit) {
            CardInstance card = iter.next();
            if (matcher.test(card)) {
                iter.remove();
                removed.add(card);
            }
        }
        return removed;
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Shuffle the deck using the provided RNG.
     * Converts to list, shuffles, then rebuilds the deque.
     */
    public void shuffle(GameRng rng) {
        List<CardInstance> list = new ArrayList<>(cards);
        rng.shuffle(list);
        cards = new ArrayDeque<>(list);
    }

    /**
     * Get an unmodifiable view of the cards, top first.
     */
    public List<CardInstance> getCards() {
        return List.copyOf(cards);
    }
}
