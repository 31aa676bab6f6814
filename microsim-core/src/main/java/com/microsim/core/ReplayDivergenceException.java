package com.microsim.core;

/**
 * Re-processing a logged run produced different state than the live run.
 * Signals hidden non-determinism; fatal.
 */
public class ReplayDivergenceException extends SimulationException {

    public static final long END_OF_LOG = -1L;

    private final long eventId;

    public ReplayDivergenceException(long eventId, String message) {
        super("Replay diverged at event " + (eventId == END_OF_LOG ? "<end of log>" : String.valueOf(eventId))
                + ": " + message);
        this.eventId = eventId;
    }

    public long getEventId() {
        return eventId;
    }
}
