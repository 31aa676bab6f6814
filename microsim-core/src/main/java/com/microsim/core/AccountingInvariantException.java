package com.microsim.core;

import java.util.Arrays;

/**
 * Zero-sum or reconciliation breach in the ledger. Always fatal for the run:
 * results produced after it cannot be trusted.
 */
public class AccountingInvariantException extends SimulationException {

    public static final long NO_EVENT = -1L;

    private final String code;
    private final long[] fillIds;
    private final long eventId;

    public AccountingInvariantException(String code, String message, long eventId, long... fillIds) {
        super(code + ": " + message + " (event=" + eventId + ", fills=" + Arrays.toString(fillIds) + ")");
        this.code = code;
        this.eventId = eventId;
        this.fillIds = fillIds.clone();
    }

    public String getCode() {
        return code;
    }

    public long getEventId() {
        return eventId;
    }

    public long[] getFillIds() {
        return fillIds.clone();
    }
}
