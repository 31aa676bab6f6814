package com.microsim.core;

/**
 * Malformed order intent. Local to the intent: it is rejected and the run
 * continues.
 */
public class InvalidOrderException extends SimulationException {

    private final long orderId;

    public InvalidOrderException(long orderId, String reason) {
        super(reason);
        this.orderId = orderId;
    }

    public long getOrderId() {
        return orderId;
    }
}
