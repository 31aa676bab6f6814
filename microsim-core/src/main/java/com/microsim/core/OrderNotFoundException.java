package com.microsim.core;

/**
 * Cancel of, or reference to, an order that is unknown or already terminal.
 * Local: the operation is rejected and the run continues.
 */
public class OrderNotFoundException extends SimulationException {

    private final long orderId;

    public OrderNotFoundException(long orderId) {
        super("Order not found or already terminal: " + orderId);
        this.orderId = orderId;
    }

    public long getOrderId() {
        return orderId;
    }
}
