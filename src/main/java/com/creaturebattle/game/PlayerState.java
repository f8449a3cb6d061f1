package com.creaturebattle.game;

import com.creaturebattle.game.zones.DiscardPile;
import com.creaturebattle.game.zones.Deck;
import com.creaturebattle.game.zones.Field;
import com.creaturebattle.game.zones.Hand;

/**
 * One player's zones and points.
 */
public class PlayerState {
    private final int id;
    private final Hand hand = new Hand();
    private final Deck deck = new Deck();
    private final DiscardPile discard = new DiscardPile();
    private final Field field;
    private int points;

    public PlayerState(int id, int maxBenchSize) {
        this.id = id;
        this.field = new Field(maxBenchSize);
    }

    public int getId() {
        return id;
    }

    public Hand getHand() {
        return hand;
    }

    public Deck getDeck() {
        return deck;
    }

    public DiscardPile getDiscard() {
        return discard;
    }

    public Field getField() {
        return field;
    }

    public int getPoints() {
        return points;
    }

    public void addPoints(int amount) {
        points += amount;
    }
}
