package com.creaturebattle.card;

/**
 * Thrown by the typed lookups on {@link CardRepository} for a template id that is
 * unknown or that names a card of another category.
 */
public class UnknownCardException extends RuntimeException {
    public UnknownCardException(String message) {
        super(message);
    }
}
