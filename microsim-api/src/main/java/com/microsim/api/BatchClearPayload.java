package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import static com.microsim.api.EventCodec.BYTE_ORDER;

/**
 * Outcome of a batch-auction clearing round, reported by the batch mechanism.
 *
 * <pre>
 *   0               8               16
 *   +---------------+---------------+
 *   | ClearingPrice |    Volume     |
 *   +---------------+---------------+
 * </pre>
 */
public final class BatchClearPayload implements EventPayload {

    public static final int CLEARING_PRICE_OFFSET = 0;
    public static final int VOLUME_OFFSET = 8;
    public static final int LENGTH = 16;

    private final long clearingPrice;
    private final long volume;

    public BatchClearPayload(long clearingPrice, long volume) {
        this.clearingPrice = clearingPrice;
        this.volume = volume;
    }

    public static BatchClearPayload decode(DirectBuffer buffer, int offset) {
        return new BatchClearPayload(
                buffer.getLong(offset + CLEARING_PRICE_OFFSET, BYTE_ORDER),
                buffer.getLong(offset + VOLUME_OFFSET, BYTE_ORDER));
    }

    @Override
    public byte kind() {
        return EventKind.BATCH_CLEAR;
    }

    @Override
    public int encodedLength() {
        return LENGTH;
    }

    @Override
    public void encode(MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + CLEARING_PRICE_OFFSET, clearingPrice, BYTE_ORDER);
        buffer.putLong(offset + VOLUME_OFFSET, volume, BYTE_ORDER);
    }

    public long clearingPrice() {
        return clearingPrice;
    }

    public long volume() {
        return volume;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BatchClearPayload)) {
            return false;
        }
        BatchClearPayload that = (BatchClearPayload) o;
        return clearingPrice == that.clearingPrice && volume == that.volume;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(clearingPrice) + Long.hashCode(volume);
    }

    @Override
    public String toString() {
        return "BatchClear{price=" + clearingPrice + ", volume=" + volume + '}';
    }
}
