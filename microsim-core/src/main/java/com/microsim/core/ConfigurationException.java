package com.microsim.core;

/**
 * Setup is unusable: a stream manager used before initialization, an invalid
 * seed-derivation input or a bad configuration value. Fatal, aborts setup.
 */
public class ConfigurationException extends SimulationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
