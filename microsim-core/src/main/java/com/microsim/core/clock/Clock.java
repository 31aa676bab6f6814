package com.microsim.core.clock;

/**
 * Read-only view of simulated time.
 */
public interface Clock {

    /**
     * @return current simulated time (the timestamp of the last processed
     *         event, or the start time before any event)
     */
    long now();
}
