package com.microsim.api;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import static com.microsim.api.EventCodec.BYTE_ORDER;

/**
 * Information shock published by the latent-value collaborator. The core does
 * not interpret the signal; it only orders and logs it.
 */
public final class NewsPayload implements EventPayload {

    public static final int SIGNAL_OFFSET = 0;
    public static final int LENGTH = 8;

    private final long signal;

    public NewsPayload(long signal) {
        this.signal = signal;
    }

    public static NewsPayload decode(DirectBuffer buffer, int offset) {
        return new NewsPayload(buffer.getLong(offset + SIGNAL_OFFSET, BYTE_ORDER));
    }

    @Override
    public byte kind() {
        return EventKind.NEWS;
    }

    @Override
    public int encodedLength() {
        return LENGTH;
    }

    @Override
    public void encode(MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + SIGNAL_OFFSET, signal, BYTE_ORDER);
    }

    public long signal() {
        return signal;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NewsPayload && ((NewsPayload) o).signal == signal;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(signal);
    }

    @Override
    public String toString() {
        return "News{signal=" + signal + '}';
    }
}
