package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import static com.microsim.api.EventCodec.BYTE_ORDER;

/**
 * Requester's acceptance of one dealer quote.
 */
public final class RfqAcceptPayload implements EventPayload {

    public static final int REQUEST_ID_OFFSET = 0;
    public static final int QUOTE_ID_OFFSET = 8;
    public static final int REQUESTER_OFFSET = 16;
    public static final int LENGTH = 24;

    private final long requestId;
    private final long quoteId;
    private final long requester;

    public RfqAcceptPayload(long requestId, long quoteId, long requester) {
        this.requestId = requestId;
        this.quoteId = quoteId;
        this.requester = requester;
    }

    public static RfqAcceptPayload decode(DirectBuffer buffer, int offset) {
        return new RfqAcceptPayload(
                buffer.getLong(offset + REQUEST_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + QUOTE_ID_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + REQUESTER_OFFSET, BYTE_ORDER));
    }

    @Override
    public byte kind() {
        return EventKind.RFQ_ACCEPT;
    }

    @Override
    public int encodedLength() {
        return LENGTH;
    }

    @Override
    public void encode(MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + REQUEST_ID_OFFSET, requestId, BYTE_ORDER);
        buffer.putLong(offset + QUOTE_ID_OFFSET, quoteId, BYTE_ORDER);
        buffer.putLong(offset + REQUESTER_OFFSET, requester, BYTE_ORDER);
    }

    public long requestId() {
        return requestId;
    }

    public long quoteId() {
        return quoteId;
    }

    public long requester() {
        return requester;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RfqAcceptPayload)) {
            return false;
        }
        RfqAcceptPayload that = (RfqAcceptPayload) o;
        return requestId == that.requestId && quoteId == that.quoteId && requester == that.requester;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(requestId);
        result = 31 * result + Long.hashCode(quoteId);
        return 31 * result + Long.hashCode(requester);
    }

    @Override
    public String toString() {
        return "RfqAccept{request=" + requestId + ", quote=" + quoteId + ", requester=" + requester + '}';
    }
}
