package com.creaturebattle.game;

/**
 * Thrown when a caller names a player, field position or card instance that does not exist.
 */
public class InvalidReferenceException extends RuntimeException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
