package com.creaturebattle.card;

/**
 * Exception thrown when a card file cannot be loaded or a card lookup fails.
 */
public class CardRepositoryException extends Exception {
    public CardRepositoryException(String message) {
        super(message);
    }

    public CardRepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
