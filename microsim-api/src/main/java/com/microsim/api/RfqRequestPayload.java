package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import static com.microsim.api.EventCodec.BYTE_ORDER;

/**
 * Request-for-quote broadcast by a requester.
 *
 * <pre>
 *   0           8           16          24   25
 *   +-----------+-----------+-----------+----+
 *   | RequestID | Requester | Quantity  |Side|
 *   +-----------+-----------+-----------+----+
 * </pre>
 */
public final class RfqRequestPayload implements EventPayload {

    public static final int REQUEST_ID_OFFSET = 0;
    public static final int REQUESTER_OFFSET = 8;
    public static final int QUANTITY_OFFSET = 16;
    public static final int SIDE_OFFSET = 24;
    public static final int LENGTH = 25;

    private final long requestId;
    private final long requester;
    private final byte side;
    private final long quantity;

    public RfqRequestPayload(long requestId, long requester, byte side, long quantity) {
        this.requestId = requestId;
        this.requester = requester;
        this.side = side;
        this.quantity = quantity;
    }

    public static RfqRequestPayload decode(DirectBuffer buffer, int offset) {
        return new RfqRequestPayload(
                buffer.getLong(offset + REQUEST_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + REQUESTER_OFFSET, BYTE_ORDER),
                buffer.getByte(offset + SIDE_OFFSET),
                buffer.getLong(offset + QUANTITY_OFFSET, BYTE_ORDER));
    }

    @Override
    public byte kind() {
        return EventKind.RFQ_REQUEST;
    }

    @Override
    public int encodedLength() {
        return LENGTH;
    }

    @Override
    public void encode(MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + REQUEST_ID_OFFSET, requestId, BYTE_ORDER);
        buffer.putLong(offset + REQUESTER_OFFSET, requester, BYTE_ORDER);
        buffer.putLong(offset + QUANTITY_OFFSET, quantity, BYTE_ORDER);
        buffer.putByte(offset + SIDE_OFFSET, side);
    }

    public long requestId() {
        return requestId;
    }

    public long requester() {
        return requester;
    }

    public byte side() {
        return side;
    }

    public long quantity() {
        return quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RfqRequestPayload)) {
            return false;
        }
        RfqRequestPayload that = (RfqRequestPayload) o;
        return requestId == that.requestId && requester == that.requester && side == that.side
                && quantity == that.quantity;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(requestId);
        result = 31 * result + Long.hashCode(requester);
        result = 31 * result + side;
        return 31 * result + Long.hashCode(quantity);
    }

    @Override
    public String toString() {
        return "RfqRequest{id=" + requestId + ", requester=" + requester + ", side=" + Side.name(side)
                + ", qty=" + quantity + '}';
    }
}
