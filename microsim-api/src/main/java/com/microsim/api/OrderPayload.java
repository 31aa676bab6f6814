package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import static com.microsim.api.EventCodec.BYTE_ORDER;

/**
 * <b>Order intent as it travels through the event queue.</b>
 *
 * <h3>Memory Layout:</h3>
 *
 * <pre>
 *   0          8          16         24         32   33
 *   +----------+----------+----------+----------+----+
 *   | OrderID  |  Owner   |  Price   | Quantity |Side|
 *   +----------+----------+----------+----------+----+
 * </pre>
 *
 * Price is in integer ticks, quantity in lots. Values are carried as given by
 * the producer; validation happens in the matching engine.
 */
public final class OrderPayload implements EventPayload {

    public static final int ORDER_ID_OFFSET = 0;
    public static final int OWNER_OFFSET = 8;
    public static final int PRICE_OFFSET = 16;
    public static final int QUANTITY_OFFSET = 24;
    public static final int SIDE_OFFSET = 32;

    public static final int LENGTH = 33;

    private final long orderId;
    private final long owner;
    private final long price;
    private final long quantity;
    private final byte side;

    public OrderPayload(long orderId, long owner, byte side, long price, long quantity) {
        this.orderId = orderId;
        this.owner = owner;
        this.side = side;
        this.price = price;
        this.quantity = quantity;
    }

    public static OrderPayload decode(DirectBuffer buffer, int offset) {
        return new OrderPayload(
                buffer.getLong(offset + ORDER_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + OWNER_OFFSET, BYTE_ORDER),
                buffer.getByte(offset + SIDE_OFFSET),
                buffer.getLong(offset + PRICE_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + QUANTITY_OFFSET, BYTE_ORDER));
    }

    @Override
    public byte kind() {
        return EventKind.ORDER;
    }

    @Override
    public int encodedLength() {
        return LENGTH;
    }

    @Override
    public void encode(MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + ORDER_ID_OFFSET, orderId, BYTE_ORDER);
        buffer.putLong(offset + OWNER_OFFSET, owner, BYTE_ORDER);
        buffer.putLong(offset + PRICE_OFFSET, price, BYTE_ORDER);
        buffer.putLong(offset + QUANTITY_OFFSET, quantity, BYTE_ORDER);
        buffer.putByte(offset + SIDE_OFFSET, side);
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

    public long quantity() {
        return quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderPayload)) {
            return false;
        }
        OrderPayload that = (OrderPayload) o;
        return orderId == that.orderId && owner == that.owner && price == that.price
                && quantity == that.quantity && side == that.side;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(orderId);
        result = 31 * result + Long.hashCode(owner);
        result = 31 * result + Long.hashCode(price);
        result = 31 * result + Long.hashCode(quantity);
        result = 31 * result + side;
        return result;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + orderId +
                ", owner=" + owner +
                ", side=" + Side.name(side) +
                ", price=" + price +
                ", qty=" + quantity +
                '}';
    }
}
