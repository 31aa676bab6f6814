package com.microsim.core;

/**
 * Root of the simulation error taxonomy. Unchecked: none of these are
 * transient faults, so nothing retries them.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
