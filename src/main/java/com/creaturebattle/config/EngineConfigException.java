package com.creaturebattle.config;

/**
 * Raised when the engine configuration cannot be read or holds invalid values.
 */
public class EngineConfigException extends Exception {
    public EngineConfigException(String message) {
        super(message);
    }

    public EngineConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
