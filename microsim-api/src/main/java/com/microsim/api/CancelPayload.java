package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import static com.microsim.api.EventCodec.BYTE_ORDER;

/**
 * Cancel request for a resting order.
 *
 * <pre>
 *   0          8          16
 *   +----------+----------+
 *   | OrderID  |  Owner   |
 *   +----------+----------+
 * </pre>
 */
public final class CancelPayload implements EventPayload {

    public static final int ORDER_ID_OFFSET = 0;
    public static final int OWNER_OFFSET = 8;

    public static final int LENGTH = 16;

    private final long orderId;
    private final long owner;

    public CancelPayload(long orderId, long owner) {
        this.orderId = orderId;
        this.owner = owner;
    }

    public static CancelPayload decode(DirectBuffer buffer, int offset) {
        return new CancelPayload(
                buffer.getLong(offset + ORDER_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + OWNER_OFFSET, BYTE_ORDER));
    }

    @Override
    public byte kind() {
        return EventKind.CANCEL;
    }

    @Override
    public int encodedLength() {
        return LENGTH;
    }

    @Override
    public void encode(MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + ORDER_ID_OFFSET, orderId, BYTE_ORDER);
        buffer.putLong(offset + OWNER_OFFSET, owner, BYTE_ORDER);
    }

    public long orderId() {
        return orderId;
    }

    public long owner() {
        return owner;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CancelPayload)) {
            return false;
        }
        CancelPayload that = (CancelPayload) o;
        return orderId == that.orderId && owner == that.owner;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(orderId) + Long.hashCode(owner);
    }

    @Override
    public String toString() {
        return "Cancel{id=" + orderId + ", owner=" + owner + '}';
    }
}
