package com.microsim.core;

import com.microsim.api.OrderStatus;
import com.microsim.api.Side;

/**
 * Immutable copy of an order's state, safe to hand out of the engine.
 */
public final class OrderView {

    private final long orderId;
    private final long owner;
    private final byte side;
    private final long price;
    private final long originalQuantity;
    private final long remainingQuantity;
    private final long entryTimestamp;
    private final long entrySequence;
    private final byte status;

    public OrderView(long orderId, long owner, byte side, long price, long originalQuantity,
            long remainingQuantity, long entryTimestamp, long entrySequence, byte status) {
        this.orderId = orderId;
        this.owner = owner;
        this.side = side;
        this.price = price;
        this.originalQuantity = originalQuantity;
        this.remainingQuantity = remainingQuantity;
        this.entryTimestamp = entryTimestamp;
        this.entrySequence = entrySequence;
        this.status = status;
    }

    public long orderId() {
        return orderId;
    }

    public long owner() {
        return owner;
    }

    public byte side() {
        return side;
    }

    public long price() {
        return price;
    }

    public long originalQuantity() {
        return originalQuantity;
    }

    public long remainingQuantity() {
        return remainingQuantity;
    }

    public long filledQuantity() {
        return originalQuantity - remainingQuantity;
    }

    public long entryTimestamp() {
        return entryTimestamp;
    }

    public long entrySequence() {
        return entrySequence;
    }

    public byte status() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderView)) {
            return false;
        }
        OrderView that = (OrderView) o;
        return orderId == that.orderId && owner == that.owner && side == that.side && price == that.price
                && originalQuantity == that.originalQuantity && remainingQuantity == that.remainingQuantity
                && entryTimestamp == that.entryTimestamp && entrySequence == that.entrySequence
                && status == that.status;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(orderId);
        result = 31 * result + Long.hashCode(owner);
        result = 31 * result + side;
        result = 31 * result + Long.hashCode(price);
        result = 31 * result + Long.hashCode(originalQuantity);
        result = 31 * result + Long.hashCode(remainingQuantity);
        result = 31 * result + Long.hashCode(entryTimestamp);
        result = 31 * result + Long.hashCode(entrySequence);
        return 31 * result + status;
    }

    @Override
    public String toString() {
        return "OrderView{" +
                "id=" + orderId +
                ", owner=" + owner +
                ", side=" + Side.name(side) +
                ", price=" + price +
                ", remaining=" + remainingQuantity + "/" + originalQuantity +
                ", entry=" + entryTimestamp + "#" + entrySequence +
                ", status=" + OrderStatus.name(status) +
                '}';
    }
}
