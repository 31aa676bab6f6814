package com.microsim.core;

import com.microsim.api.OrderStatus;
import com.microsim.api.Side;

/**
 * The internal Order representation for the Matching Engine.
 * <p>
 * This is the "heavy" object that sits in the OrderBook. It is pooled, so
 * nothing outside the book may hold on to one; callers get an
 * {@link OrderView} copy instead.
 * </p>
 * <p>
 * Priority is {@code (entryTimestamp, entrySequence)} and is fixed on entry.
 * A partial fill only lowers {@code remainingQuantity}.
 * </p>
 */
public class Order {
    public long id;
    public long owner;
    public byte side;
    public long price;
    public long originalQuantity;
    public long remainingQuantity;
    public long entryTimestamp;
    public long entrySequence;
    public byte status;

    // Intrusive links inside the owning PriceLevel
    public Order next;
    public Order prev;

    public long filledQuantity() {
        return originalQuantity - remainingQuantity;
    }

    /**
     * @return true if this order entered the book before {@code other}
     */
    public boolean hasPriorityOver(Order other) {
        if (entryTimestamp != other.entryTimestamp) {
            return entryTimestamp < other.entryTimestamp;
        }
        return entrySequence < other.entrySequence;
    }

    /**
     * Consumes {@code quantity} and updates the status accordingly.
     */
    public void fill(long quantity) {
        remainingQuantity -= quantity;
        status = remainingQuantity == 0 ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
    }

    public OrderView toView() {
        return new OrderView(id, owner, side, price, originalQuantity, remainingQuantity,
                entryTimestamp, entrySequence, status);
    }

    public void reset() {
        id = 0;
        owner = 0;
        side = 0;
        price = 0;
        originalQuantity = 0;
        remainingQuantity = 0;
        entryTimestamp = 0;
        entrySequence = 0;
        status = 0;
        next = null;
        prev = null;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", owner=" + owner +
                ", side=" + Side.name(side) +
                ", price=" + price +
                ", remaining=" + remainingQuantity + "/" + originalQuantity +
                ", entry=" + entryTimestamp + "#" + entrySequence +
                ", status=" + OrderStatus.name(status) +
                '}';
    }
}
